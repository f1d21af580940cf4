package com.cw.contentflow.DTO;

import lombok.Value;

/**
 * 컨텍스트 검색 결과 (렌더링된 라인 + 매칭 건수)
 */
@Value
public class ContextResult {
    public static final ContextResult EMPTY = new ContextResult("", 0);

    String context;
    int matchedCount;
}
