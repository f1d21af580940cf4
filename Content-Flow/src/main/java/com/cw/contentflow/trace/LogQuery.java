package com.cw.contentflow.trace;

import lombok.Builder;
import lombok.Value;

/**
 * 로그 조회 필터. 빈 값은 조건에서 빠진다.
 */
@Value
@Builder
public class LogQuery {
    public static final int DEFAULT_LIMIT = 200;
    public static final int MAX_LIMIT = 1000;

    String traceId;
    String component;
    String level;
    String keyword;
    Integer limit;

    public int safeLimit() {
        int requested = limit == null ? DEFAULT_LIMIT : limit;
        return Math.max(1, Math.min(requested, MAX_LIMIT));
    }
}
