package com.cw.contentflow.service;

import com.cw.contentflow.DTO.NormalizedItem;
import com.cw.contentflow.DTO.SourceDescriptor;
import com.cw.contentflow.config.ContentFlowProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 소스 1개 스캔. 네트워크 소스는 피드 워커(/scan), 정적 파일은 로컬 파서.
 * 실패하면 예외 → 해당 소스의 사이클 전체가 실패 처리된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedService {
    private final WorkerHttpClient workerHttpClient;
    private final StaticFeedReader staticFeedReader;
    private final ContentFlowProperties properties;
    private final ObjectMapper objectMapper;

    static final String WORKER = "feed";

    public List<NormalizedItem> fetch(SourceDescriptor source) {
        List<NormalizedItem> items;
        if (source.resolvedTransport() == SourceDescriptor.Transport.STATIC_FILE) {
            try {
                items = staticFeedReader.read(source);
            } catch (IOException e) {
                throw new WorkerCallException(WORKER, false, 0, "static feed unreadable: " + source.getUrl(), e);
            }
        } else {
            items = scanRemote(source);
        }

        int limit = Math.max(0, source.getMaxItems());
        if (items.size() > limit) {
            items = new ArrayList<>(items.subList(0, limit));
        }
        log.info("📡 스캔 완료 [{}]: {}건 ({})", source.getId(), items.size(), source.resolvedTransport());
        return items;
    }

    private List<NormalizedItem> scanRemote(SourceDescriptor source) {
        String url = properties.getWorkers().getFeedUrl() + "/scan";
        Map<String, Object> body = workerHttpClient.postJson(WORKER, url, Map.of("source_config", source));
        Object rawItems = body.get("items");
        if (rawItems == null) {
            return new ArrayList<>();
        }
        List<NormalizedItem> items = objectMapper.convertValue(rawItems, new TypeReference<List<NormalizedItem>>() {});
        for (NormalizedItem item : items) {
            if (item.getSourceId() == null || item.getSourceId().isBlank()) item.setSourceId(source.getId());
            if (item.getFingerprint() == null || item.getFingerprint().isBlank()) {
                item.setFingerprint(ContentHash.fingerprint(item.getUrl(), item.getTitle()));
            }
        }
        return items;
    }
}
