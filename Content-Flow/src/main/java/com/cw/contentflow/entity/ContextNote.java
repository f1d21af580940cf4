package com.cw.contentflow.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 과거 요약 인덱스 (증분 작성용 컨텍스트). append-only, 키워드 중복 허용.
 */
@Entity
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "CF_CONTEXT_NOTE", indexes = @Index(name = "IDX_CF_CONTEXT_CREATED", columnList = "CREATED_AT"))
public class ContextNote {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "FINGERPRINT", length = 64)
    private String fingerprint;

    @Column(name = "SOURCE_ID", length = 128)
    private String sourceId;

    @Column(name = "TITLE", length = 500)
    private String title;

    @Column(name = "URL", length = 1000)
    private String url;

    @Column(name = "SUMMARY", length = 2000)
    private String summary;

    @Column(name = "KEYWORDS", length = 1000)
    private String keywords; // 소문자, 콤마 구분

    @Column(name = "ARCHIVE_URL", length = 1000)
    private String archiveUrl;

    @Column(name = "IMAGE_URL", length = 1000)
    private String imageUrl;

    @Column(name = "CREATED_AT", nullable = false)
    private LocalDateTime createdAt;
}
