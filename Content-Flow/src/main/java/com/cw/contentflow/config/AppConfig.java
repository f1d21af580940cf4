package com.cw.contentflow.config;

import com.cw.contentflow.trace.MdcTaskDecorator;
import com.cw.contentflow.trace.TraceHeaderInterceptor;
import com.cw.contentflow.service.WorkerCallException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Bean 설정
 * - 워커 호출용 RestTemplate (타임아웃 + trace 헤더 인터셉터)
 * - 워커 호출 재시도 정책 (Resilience4j)
 * - 파이프라인 스케줄러 / 초안 생성 스레드 풀
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AppConfig {

    private final ContentFlowProperties properties;

    /**
     * RestTemplate Bean 생성
     * - 모든 워커 요청에 X-Trace-Id / X-Request-Id (+ 선택적 X-API-Key) 자동 추가
     * - 타임아웃: connect / read(soTimeout) 분리 설정
     */
    @Bean
    public RestTemplate restTemplate() {
        ContentFlowProperties.Workers workers = properties.getWorkers();

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultSocketConfig(SocketConfig.custom()
                        .setSoTimeout(Timeout.ofMilliseconds(workers.getReadTimeoutMs()))
                        .build())
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .build();

        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(httpClient);
        factory.setConnectTimeout(workers.getConnectTimeoutMs());

        RestTemplate restTemplate = new RestTemplate(factory);

        List<ClientHttpRequestInterceptor> interceptors = restTemplate.getInterceptors();
        interceptors.add(new TraceHeaderInterceptor(workers.getApiKey()));
        restTemplate.setInterceptors(interceptors);

        log.info("✅ RestTemplate Bean 생성 완료 (connect {}ms / read {}ms, trace 헤더 인터셉터 활성화)",
                workers.getConnectTimeoutMs(), workers.getReadTimeoutMs());
        return restTemplate;
    }

    /**
     * 일시적 실패(연결 오류, 타임아웃, 5xx)만 지수 백오프로 재시도. 4xx 는 즉시 실패.
     */
    @Bean
    public RetryRegistry workerRetryRegistry() {
        ContentFlowProperties.Retry retry = properties.getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, retry.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retry.getInitialBackoffMs(), retry.getMultiplier(), retry.getMaxBackoffMs()))
                .retryOnException(e -> e instanceof WorkerCallException w && w.isTransientFailure())
                .build();
        return RetryRegistry.of(config);
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler pipelineTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getScheduler().getPoolSize()));
        scheduler.setThreadNamePrefix("pulse-");
        scheduler.setErrorHandler(t -> log.error("🚨 스케줄 작업 오류: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor draftTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = Math.max(1, properties.getDrafts().getPoolSize());
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("draft-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
