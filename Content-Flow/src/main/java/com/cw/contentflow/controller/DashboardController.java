package com.cw.contentflow.controller;

import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.RecordType;
import com.cw.contentflow.repository.ContentPackageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final ContentPackageRepository packageRepo;

    /**
     * 최근 아카이브 목록 (recordType=topic|draft, traceId 필터)
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(required = false) String recordType,
            @RequestParam(required = false) String traceId,
            @RequestParam(defaultValue = "20") int limit
    ) {
        Pageable page = PageRequest.of(0, Math.max(1, Math.min(limit, 200)));
        RecordType type = recordType == null || recordType.isBlank()
                ? null : RecordType.valueOf(recordType.trim().toUpperCase(Locale.ROOT));
        boolean byTrace = traceId != null && !traceId.isBlank();

        List<ContentPackage> items;
        if (type != null && byTrace) {
            items = packageRepo.findByRecordTypeAndTraceIdOrderByIdDesc(type, traceId, page);
        } else if (type != null) {
            items = packageRepo.findByRecordTypeOrderByIdDesc(type, page);
        } else if (byTrace) {
            items = packageRepo.findByTraceIdOrderByIdDesc(traceId, page);
        } else {
            items = packageRepo.findAllByOrderByIdDesc(page);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", items.size());
        result.put("topics", packageRepo.countByRecordType(RecordType.TOPIC));
        result.put("drafts", packageRepo.countByRecordType(RecordType.DRAFT));
        result.put("items", items);
        return ResponseEntity.ok(result);
    }
}
