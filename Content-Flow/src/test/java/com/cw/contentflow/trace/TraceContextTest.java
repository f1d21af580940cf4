package com.cw.contentflow.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceContextTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    void idsAreNormalizedToSafeCharacters() {
        assertThat(TraceContext.normalize("abc/../def<script>")).isEqualTo("abcdefscript");
        assertThat(TraceContext.normalize("t1-twitter_2")).isEqualTo("t1-twitter_2");
        assertThat(TraceContext.normalize("x".repeat(100))).hasSize(64);
        assertThat(TraceContext.normalize("!!!", "fallback")).isEqualTo("fallback");
        assertThat(TraceContext.newTraceId()).hasSize(16).matches("[0-9a-f]+");
    }

    @Test
    void childScopeCarriesParentAndRestoresOnClose() {
        try (TraceContext.Scope cycle = TraceContext.open("cycle1", "scheduler")) {
            try (TraceContext.Scope item = TraceContext.openChild("item1", "scheduler")) {
                assertThat(MDC.get(TraceContext.TRACE_ID)).isEqualTo("item1");
                assertThat(MDC.get(TraceContext.PARENT_TRACE_ID)).isEqualTo("cycle1");
            }
            assertThat(MDC.get(TraceContext.TRACE_ID)).isEqualTo("cycle1");
            assertThat(MDC.get(TraceContext.PARENT_TRACE_ID)).isNull();
        }
        assertThat(MDC.get(TraceContext.TRACE_ID)).isNull();
        assertThat(MDC.get(TraceContext.COMPONENT)).isNull();
    }

    @Test
    void openWithBlankIdGeneratesOne() {
        try (TraceContext.Scope ignored = TraceContext.open("", "http")) {
            assertThat(TraceContext.currentTraceId()).hasSize(16);
        }
    }

    @Test
    void taskDecoratorCopiesCallerContextIntoWorkerThread() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable decorated;
        try (TraceContext.Scope ignored = TraceContext.open("topic-7", "draft-expander")) {
            decorated = new MdcTaskDecorator().decorate(() -> seen.set(TraceContext.currentTraceId()));
        }

        Thread worker = new Thread(decorated);
        worker.start();
        worker.join();

        assertThat(seen.get()).isEqualTo("topic-7");
    }
}
