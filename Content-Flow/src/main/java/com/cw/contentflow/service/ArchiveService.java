package com.cw.contentflow.service;

import com.cw.contentflow.DTO.ArchiveReceipt;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.RecordType;
import com.cw.contentflow.repository.ContentPackageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 아카이브 체인: 앞 백엔드부터 시도, 처음 성공한 것이 결과를 낸다.
 * 성공한 패키지는 대시보드 테이블에 저장 (처리한 백엔드 기록). 초안은 traceId 당 1행.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveService {
    private final List<ArchiveBackend> backends;
    private final ContentPackageRepository packageRepo;

    public ArchiveReceipt archive(ContentPackage pack) {
        RuntimeException lastError = null;
        for (ArchiveBackend backend : backends) {
            if (!backend.isEnabled()) continue;
            String docUrl;
            try {
                docUrl = backend.write(pack);
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("⚠️ 아카이브 백엔드 실패 [{}] {}: {}", backend.name(), pack.getTraceId(), e.getMessage());
                continue;
            }
            pack.setDocUrl(docUrl);
            pack.setArchiveBackend(backend.name());
            if (pack.getRecordType() == RecordType.DRAFT && pack.getId() == null) {
                // force 재생성은 같은 초안 행을 덮어쓴다
                packageRepo.findFirstByTraceIdAndRecordType(pack.getTraceId(), RecordType.DRAFT)
                        .ifPresent(existing -> pack.setId(existing.getId()));
            }
            packageRepo.save(pack);
            log.info("💾 아카이브 완료 [{}] {} → {}", backend.name(), pack.getTraceId(), docUrl);
            return new ArchiveReceipt(docUrl, backend.name());
        }
        throw new ArchiveException("all archive backends failed for " + pack.getTraceId(), lastError);
    }
}
