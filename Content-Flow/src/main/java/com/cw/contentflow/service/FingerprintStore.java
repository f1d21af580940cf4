package com.cw.contentflow.service;

import com.cw.contentflow.repository.FingerprintRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 핑거프린트(중복 차단) 원장.
 * - remember 는 insert-if-absent: 이미 있으면 no-op, 예외 없음
 * - PK 가 유일성을 보장하고, 충돌은 "선점 실패"(false)로 돌려준다 → 행은 항상 1개
 * - sweep 은 시작 시점에 고정한 cutoff 하나로 단일 DELETE
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintStore {
    private final FingerprintRepository fingerprintRepo;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private static final String INSERT = "INSERT INTO CF_FINGERPRINT (FINGERPRINT, SOURCE_ID, FIRST_SEEN_AT) VALUES (?, ?, ?)";

    private static final String DELETE_OLDER_THAN = "DELETE FROM CF_FINGERPRINT WHERE FIRST_SEEN_AT <= ?";

    public boolean isDuplicate(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) return false;
        return fingerprintRepo.existsById(fingerprint);
    }

    /**
     * @return 이 호출이 행을 새로 넣었으면 true (선점 성공), 이미 있었으면 false
     */
    public boolean remember(String fingerprint, String sourceId) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint must not be blank");
        }
        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        try {
            jdbcTemplate.update(INSERT, fingerprint, sourceId == null ? "unknown" : sourceId, now);
            log.debug("🧠 핑거프린트 기록: {} (source={})", shortHash(fingerprint), sourceId);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("🧠 이미 기록된 핑거프린트: {}", shortHash(fingerprint));
            return false;
        }
    }

    /**
     * 보존기간이 지난 기록 삭제. retentionDays=0 이면 지금까지 기록된 전부.
     */
    public int sweep(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0: " + retentionDays);
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
        int removed = jdbcTemplate.update(DELETE_OLDER_THAN, Timestamp.valueOf(cutoff));
        log.info("🧹 핑거프린트 정리 완료: {}건 삭제 (보존 {}일, cutoff={})", removed, retentionDays, cutoff);
        return removed;
    }

    public long count() {
        return fingerprintRepo.count();
    }

    static String shortHash(String fingerprint) {
        return fingerprint.substring(0, Math.min(16, fingerprint.length()));
    }
}
