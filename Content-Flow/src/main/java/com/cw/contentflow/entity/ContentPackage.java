package com.cw.contentflow.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 아카이브 단위. topic(발굴 원본) 또는 draft(플랫폼별 생성물).
 * draft 의 traceId 는 항상 topicTraceId + "-" + platform.
 */
@Entity
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "CF_CONTENT_PACKAGE", indexes = {
        @Index(name = "IDX_CF_PACKAGE_TRACE", columnList = "TRACE_ID"),
        @Index(name = "IDX_CF_PACKAGE_TYPE", columnList = "RECORD_TYPE")
}, uniqueConstraints = {
        @UniqueConstraint(name = "UK_CF_PACKAGE_DRAFT", columnNames = "DRAFT_KEY")
})
public class ContentPackage {
    public static final String STATUS_PENDING = "pending_confirmation";
    public static final String STATUS_DRAFT_READY = "draft_ready";

    static final int TITLE_LENGTH = 500;
    static final int SOURCE_INFO_LENGTH = 200;
    static final int SOURCE_URL_LENGTH = 1000;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "RECORD_TYPE", nullable = false, length = 16)
    private RecordType recordType;

    @Column(name = "TRACE_ID", nullable = false, length = 128)
    private String traceId;

    @Column(name = "TOPIC_TRACE_ID", length = 64)
    private String topicTraceId;

    @Column(name = "PLATFORM", length = 32)
    private String platform;

    @Column(name = "SOURCE_ID", length = 128)
    private String sourceId;

    @Column(name = "SOURCE_INFO", length = SOURCE_INFO_LENGTH)
    private String sourceInfo;

    @Column(name = "FINGERPRINT", length = 64)
    private String fingerprint;

    @Column(name = "TITLE", length = TITLE_LENGTH)
    private String title;

    @Column(name = "SUMMARY", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "SOURCE_URL", length = SOURCE_URL_LENGTH)
    private String sourceUrl;

    @Column(name = "RELATED_CONTEXT", columnDefinition = "TEXT")
    private String relatedContext; // 과거 유사 요약 (증분 작성용)

    @Convert(converter = StringListConverter.class)
    @Column(name = "CHANNELS", length = 500)
    @Builder.Default
    private List<String> channels = new ArrayList<>();

    @Column(name = "STATUS", length = 64)
    private String status;

    @Column(name = "SHORT_COPY", columnDefinition = "TEXT")
    private String shortCopy;

    @Column(name = "LONG_ARTICLE", columnDefinition = "TEXT")
    private String longArticle;

    @Column(name = "IMAGE_PROMPT", columnDefinition = "TEXT")
    private String imagePrompt;

    @Convert(converter = StringListConverter.class)
    @Column(name = "IMAGE_URLS", length = 4000)
    @Builder.Default
    private List<String> imageUrls = new ArrayList<>();

    @Column(name = "DOC_URL", length = 1000)
    private String docUrl;

    @Column(name = "ARCHIVE_BACKEND", length = 16)
    private String archiveBackend;

    // 초안만 traceId, 토픽은 null (토픽은 sweep 후 재발견되면 새 행)
    @Column(name = "DRAFT_KEY", length = 128)
    private String draftKey;

    @Column(name = "CREATED_AT", updatable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @PrePersist
    @PreUpdate
    void beforeSave() {
        draftKey = recordType == RecordType.DRAFT ? traceId : null;
        title = clip(title, TITLE_LENGTH);
        sourceInfo = clip(sourceInfo, SOURCE_INFO_LENGTH);
        sourceUrl = clip(sourceUrl, SOURCE_URL_LENGTH);
    }

    private static String clip(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    public String firstImageUrl() {
        return imageUrls == null || imageUrls.isEmpty() ? "" : imageUrls.get(0);
    }
}
