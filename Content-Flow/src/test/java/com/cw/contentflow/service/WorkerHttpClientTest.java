package com.cw.contentflow.service;

import com.cw.contentflow.config.AppConfig;
import com.cw.contentflow.config.ContentFlowProperties;
import com.cw.contentflow.trace.TraceContext;
import com.cw.contentflow.trace.TraceHeaderInterceptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WorkerHttpClientTest {

    static final String URL = "http://generation.test/think";

    RestTemplate restTemplate;
    MockRestServiceServer server;
    WorkerHttpClient client;

    @BeforeEach
    void setUp() {
        ContentFlowProperties properties = new ContentFlowProperties();
        properties.getRetry().setInitialBackoffMs(5);
        properties.getRetry().setMaxBackoffMs(20);

        restTemplate = new RestTemplate();
        restTemplate.getInterceptors().add(new TraceHeaderInterceptor("secret-key"));
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new WorkerHttpClient(restTemplate, new AppConfig(properties).workerRetryRegistry());
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        server.expect(ExpectedCount.times(2), requestTo(URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"twitter_draft\":\"ok\"}", MediaType.APPLICATION_JSON));

        Map<String, Object> body = client.postJson("generation", URL, Map.of("title", "t"));

        assertThat(body).containsEntry("twitter_draft", "ok");
        server.verify();
    }

    @Test
    void retriesStopAfterMaxAttempts() {
        server.expect(ExpectedCount.times(3), requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        WorkerCallException e = catchThrowableOfType(
                () -> client.postJson("generation", URL, Map.of("title", "t")), WorkerCallException.class);

        assertThat(e).isNotNull();
        assertThat(e.isTransientFailure()).isTrue();
        assertThat(e.getStatusCode()).isEqualTo(502);
        assertThat(e.getWorker()).isEqualTo("generation");
        server.verify();
    }

    @Test
    void clientErrorsFailFast() {
        server.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        WorkerCallException e = catchThrowableOfType(
                () -> client.postJson("generation", URL, Map.of("title", "t")), WorkerCallException.class);

        assertThat(e.isTransientFailure()).isFalse();
        assertThat(e.getStatusCode()).isEqualTo(400);
        server.verify();
    }

    @Test
    void traceAndKeyHeadersTravelWithEveryCall() {
        server.expect(requestTo(URL))
                .andExpect(header(TraceContext.TRACE_HEADER, "cycle-trace-1"))
                .andExpect(header("X-API-Key", "secret-key"))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        try (TraceContext.Scope ignored = TraceContext.open("cycle-trace-1", "test")) {
            client.postJson("generation", URL, Map.of("title", "t"));
        }
        server.verify();
    }
}
