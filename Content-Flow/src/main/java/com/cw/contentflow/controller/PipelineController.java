package com.cw.contentflow.controller;

import com.cw.contentflow.DTO.CycleReport;
import com.cw.contentflow.service.PipelineScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineScheduler pipelineScheduler;

    /**
     * 수동 실행 (sourceId 없으면 전체 소스)
     */
    @PostMapping("/run-once")
    public ResponseEntity<Map<String, Object>> runOnce(@RequestParam(required = false) String sourceId) {
        log.info(">>> 수동 실행 요청: source={}", sourceId == null ? "ALL" : sourceId);

        List<CycleReport> reports = sourceId == null || sourceId.isBlank()
                ? pipelineScheduler.runAllOnce()
                : List.of(pipelineScheduler.runSource(sourceId));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("reports", reports);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(pipelineScheduler.status());
    }

    /**
     * rules 리로드. 실패하면 기존 rules 유지 + 500
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        log.info(">>> rules 리로드 요청");
        return ResponseEntity.ok(pipelineScheduler.reload());
    }

    @PostMapping("/sweep")
    public ResponseEntity<Map<String, Object>> sweep(@RequestParam(required = false) Integer retentionDays) {
        log.info(">>> 보존기간 정리 요청: days={}", retentionDays);
        return ResponseEntity.ok(pipelineScheduler.sweep(retentionDays));
    }
}
