package com.cw.contentflow.controller;

import com.cw.contentflow.DTO.ExpansionResult;
import com.cw.contentflow.service.DraftExpanderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 외부 테이블 확인 콜백. 검증 실패도 200 으로 응답 (재전송 방지)
 */
@Slf4j
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class ConfirmationController {

    private final DraftExpanderService draftExpanderService;

    @PostMapping("/confirmation")
    public ResponseEntity<Object> confirmation(@RequestBody Map<String, Object> payload,
                                               @RequestParam(defaultValue = "false") boolean force) {
        ExpansionResult result = draftExpanderService.handle(payload, force);
        if (result.getStatus() == ExpansionResult.Status.HANDSHAKE) {
            return ResponseEntity.ok(Map.of("challenge", result.getChallenge()));
        }
        return ResponseEntity.ok(result);
    }
}
