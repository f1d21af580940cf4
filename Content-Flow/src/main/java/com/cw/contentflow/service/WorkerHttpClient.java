package com.cw.contentflow.service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * 워커 공통 JSON POST.
 * 타임아웃은 RestTemplate 팩토리에서, 재시도는 워커 이름별 Resilience4j Retry 로.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerHttpClient {
    private final RestTemplate restTemplate;
    private final RetryRegistry workerRetryRegistry;

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {};

    public Map<String, Object> postJson(String worker, String url, Object body) {
        Retry retry = workerRetryRegistry.retry(worker);
        return Retry.decorateSupplier(retry, () -> postOnce(worker, url, body)).get();
    }

    private Map<String, Object> postOnce(String worker, String url, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Object> entity = new HttpEntity<>(body, headers);
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(url, HttpMethod.POST, entity, JSON_MAP);
            Map<String, Object> responseBody = response.getBody();
            if (responseBody == null) {
                throw new WorkerCallException(worker, "empty response body from " + url);
            }
            return responseBody;
        } catch (HttpServerErrorException e) {
            log.warn("⚠️ {} 워커 5xx 응답: {} {}", worker, e.getStatusCode().value(), url);
            throw new WorkerCallException(worker, true, e.getStatusCode().value(), "server error " + e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            log.warn("⚠️ {} 워커 요청 거부(재시도 안 함): {} {}", worker, e.getStatusCode().value(), url);
            throw new WorkerCallException(worker, false, e.getStatusCode().value(), "client error " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("⚠️ {} 워커 연결 실패/타임아웃: {} ({})", worker, url, e.getMessage());
            throw new WorkerCallException(worker, true, 0, "unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new WorkerCallException(worker, false, 0, e.getMessage(), e);
        }
    }
}
