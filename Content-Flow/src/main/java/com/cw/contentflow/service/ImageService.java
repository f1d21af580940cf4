package com.cw.contentflow.service;

import com.cw.contentflow.config.ContentFlowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 이미지 워커(/paint) 호출. 워커 쪽에서 실패 시 결정적 플레이스홀더 URL 을 준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageService {
    private final WorkerHttpClient workerHttpClient;
    private final ContentFlowProperties properties;

    static final String WORKER = "image";

    public String paint(String prompt, String ratio) {
        String url = properties.getWorkers().getImageUrl() + "/paint";
        Map<String, Object> body = workerHttpClient.postJson(WORKER, url, Map.of("prompt", prompt, "ratio", ratio));
        Object imageUrl = body.get("image_url");
        if (imageUrl == null || imageUrl.toString().isBlank()) {
            throw new WorkerCallException(WORKER, "image worker returned no image_url");
        }
        log.debug("🎨 이미지 생성 ({}): {}", ratio, imageUrl);
        return imageUrl.toString().trim();
    }
}
