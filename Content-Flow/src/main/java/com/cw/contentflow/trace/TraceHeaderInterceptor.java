package com.cw.contentflow.trace;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;

/**
 * 워커 호출 인터셉터
 * - 현재 MDC 의 traceId / requestId 를 헤더로 전달
 * - apiKey 가 설정돼 있으면 X-API-Key 헤더 추가
 */
@Slf4j
public class TraceHeaderInterceptor implements ClientHttpRequestInterceptor {

    private final String apiKey;

    public TraceHeaderInterceptor(String apiKey) {
        this.apiKey = apiKey;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        String traceId = TraceContext.currentTraceId();
        String requestId = TraceContext.currentRequestId();
        if (!traceId.isEmpty()) {
            request.getHeaders().set(TraceContext.TRACE_HEADER, traceId);
        }
        if (!requestId.isEmpty()) {
            request.getHeaders().set(TraceContext.REQUEST_HEADER, requestId);
        }

        if (apiKey != null && !apiKey.isBlank()) {
            request.getHeaders().set("X-API-Key", apiKey);
            if (log.isDebugEnabled()) {
                String maskedKey = apiKey.substring(0, Math.min(8, apiKey.length())) + "...";
                log.debug("🔑 X-API-Key 헤더 추가: {} -> {}", request.getURI(), maskedKey);
            }
        }
        return execution.execute(request, body);
    }
}
