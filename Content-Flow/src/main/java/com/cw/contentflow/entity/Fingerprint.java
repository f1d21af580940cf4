package com.cw.contentflow.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 중복 차단 원장. 있으면 "이미 처리됨", 없으면 "처리 대상".
 * 쓰기는 FingerprintStore 의 insert-if-absent 로만 한다.
 */
@Entity
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "CF_FINGERPRINT", indexes = @Index(name = "IDX_CF_FINGERPRINT_SEEN", columnList = "FIRST_SEEN_AT"))
public class Fingerprint {
    @Id
    @Column(name = "FINGERPRINT", length = 64)
    private String fingerprint; // SHA-256 hex

    @Column(name = "SOURCE_ID", nullable = false, length = 128)
    private String sourceId;

    @Column(name = "FIRST_SEEN_AT", nullable = false)
    private LocalDateTime firstSeenAt;
}
