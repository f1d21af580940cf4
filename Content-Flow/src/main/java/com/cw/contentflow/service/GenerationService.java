package com.cw.contentflow.service;

import com.cw.contentflow.DTO.ThinkResult;
import com.cw.contentflow.config.ContentFlowProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * 텍스트 생성 워커(/think) 호출
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationService {
    private final WorkerHttpClient workerHttpClient;
    private final ContentFlowProperties properties;
    private final ObjectMapper objectMapper;

    static final String WORKER = "generation";

    public ThinkResult think(String title, String rawText, String historyContext, Map<String, Object> platformStrategy) {
        String url = properties.getWorkers().getGenerationUrl() + "/think";
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("title", title);
        requestBody.put("raw_text", rawText);
        requestBody.put("history_context", historyContext == null ? "" : historyContext);
        requestBody.put("platform_strategy", platformStrategy);

        log.info("🚀 생성 요청: {}", title);
        Map<String, Object> body = workerHttpClient.postJson(WORKER, url, requestBody);
        ThinkResult result = objectMapper.convertValue(body, ThinkResult.class);
        if (isBlank(result.getTwitterDraft()) && isBlank(result.getArticleMarkdown())) {
            throw new WorkerCallException(WORKER, "generation returned neither short copy nor article");
        }
        log.info("✅ 생성 응답 (단문 {}자 / 장문 {}자)",
                length(result.getTwitterDraft()), length(result.getArticleMarkdown()));
        return result;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }
}
