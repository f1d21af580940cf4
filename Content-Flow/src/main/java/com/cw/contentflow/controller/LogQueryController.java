package com.cw.contentflow.controller;

import com.cw.contentflow.trace.LogEntry;
import com.cw.contentflow.trace.LogQuery;
import com.cw.contentflow.trace.LogStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 프로세스 내 로그 조회 (trace 하나로 스캔 → 아카이브 → 초안까지 따라가기)
 */
@RestController
@RequestMapping("/logs")
@RequiredArgsConstructor
public class LogQueryController {

    private final LogStore logStore;

    @GetMapping
    public ResponseEntity<Map<String, Object>> query(
            @RequestParam(required = false) String traceId,
            @RequestParam(required = false) String component,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String keyword,
            @RequestParam(required = false) Integer limit
    ) {
        LogQuery query = LogQuery.builder()
                .traceId(traceId)
                .component(component)
                .level(level)
                .keyword(keyword)
                .limit(limit)
                .build();
        return ResponseEntity.ok(body(logStore.query(query)));
    }

    @GetMapping("/trace/{traceId}")
    public ResponseEntity<Map<String, Object>> byTrace(@PathVariable String traceId,
                                                       @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(body(logStore.query(LogQuery.builder().traceId(traceId).limit(limit).build())));
    }

    private static Map<String, Object> body(List<LogEntry> entries) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", entries.size());
        result.put("entries", entries);
        return result;
    }
}
