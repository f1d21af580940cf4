package com.cw.contentflow.DTO;

import lombok.Value;

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * 현재 적용 중인 rules 문서 (리로드 시 통째로 교체)
 */
@Value
public class RulesSnapshot {
    RulesConfig rules;
    String fingerprint; // 문서 바이트의 SHA-256
    ZoneId zone;
    LocalDateTime loadedAt;
}
