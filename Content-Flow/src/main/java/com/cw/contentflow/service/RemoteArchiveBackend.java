package com.cw.contentflow.service;

import com.cw.contentflow.config.ContentFlowProperties;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.RecordType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 원격 문서 저장소 워커 (/archive). archive-url 이 비어 있으면 비활성.
 */
@Slf4j
@Order(1)
@Component
@RequiredArgsConstructor
public class RemoteArchiveBackend implements ArchiveBackend {
    private final WorkerHttpClient workerHttpClient;
    private final ContentFlowProperties properties;

    static final String WORKER = "archive";

    @Override
    public String name() {
        return "REMOTE";
    }

    @Override
    public boolean isEnabled() {
        String url = properties.getWorkers().getArchiveUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public String write(ContentPackage pack) {
        String url = properties.getWorkers().getArchiveUrl() + "/archive";
        Map<String, Object> body = workerHttpClient.postJson(WORKER, url, Map.of("content_pack", toWire(pack)));

        Object docUrl = body.get("feishu_doc_url");
        if (docUrl == null || docUrl.toString().isBlank()) {
            docUrl = body.get("doc_url");
        }
        if (docUrl == null || docUrl.toString().isBlank()) {
            throw new WorkerCallException(WORKER, "archive worker returned no document url (status=" + body.get("status") + ")");
        }
        return docUrl.toString().trim();
    }

    /**
     * 워커 쪽 필드명 (snake_case)
     */
    static Map<String, Object> toWire(ContentPackage pack) {
        boolean topic = pack.getRecordType() == RecordType.TOPIC;
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("record_type", topic ? "topic" : "draft");
        wire.put("trace_id", pack.getTraceId());
        wire.put("topic_trace_id", pack.getTopicTraceId());
        wire.put("platform", pack.getPlatform());
        wire.put("source_id", pack.getSourceId());
        wire.put("source_info", pack.getSourceInfo());
        wire.put("url_hash", pack.getFingerprint());
        wire.put("title", pack.getTitle());
        wire.put(topic ? "topic_summary" : "ai_summary", pack.getSummary());
        wire.put("source_url", pack.getSourceUrl());
        wire.put("channels", pack.getChannels());
        wire.put("status", pack.getStatus());
        wire.put("related_context", pack.getRelatedContext());
        if (!topic) {
            wire.put("twitter_draft", pack.getShortCopy());
            wire.put("article_markdown", pack.getLongArticle());
            wire.put("image_prompt", pack.getImagePrompt());
            wire.put("image_urls", pack.getImageUrls());
            wire.put("image_url", pack.firstImageUrl());
        }
        return wire;
    }
}
