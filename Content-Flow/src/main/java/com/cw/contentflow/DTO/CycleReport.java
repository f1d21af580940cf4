package com.cw.contentflow.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 하트비트 1회 결과 (소스별 last run 으로 보관)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleReport {

    public enum Outcome { COMPLETED, FAILED, SKIPPED_BUSY }

    private String sourceId;
    private String traceId;
    private Outcome outcome;
    private int scanned;
    private int duplicated;
    private int filtered;
    private int processed;
    private int failed;
    private String error;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;

    public static CycleReport skipped(String sourceId, LocalDateTime now) {
        return CycleReport.builder()
                .sourceId(sourceId)
                .outcome(Outcome.SKIPPED_BUSY)
                .startedAt(now)
                .endedAt(now)
                .build();
    }
}
