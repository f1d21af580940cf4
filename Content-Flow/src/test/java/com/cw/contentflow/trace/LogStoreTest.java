package com.cw.contentflow.trace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LogStoreTest {

    LogStore store;

    @BeforeEach
    void setUp() {
        store = new LogStore(5);
    }

    @Test
    void oldestEntriesAreEvictedPastCapacity() {
        for (int i = 1; i <= 7; i++) {
            store.add(entry("INFO", "scheduler", "message " + i, "t" + i, ""));
        }

        List<LogEntry> all = store.query(LogQuery.builder().build());

        assertThat(store.size()).isEqualTo(5);
        assertThat(all).extracting(LogEntry::getMessage)
                .containsExactly("message 7", "message 6", "message 5", "message 4", "message 3");
    }

    @Test
    void traceQueryMatchesChildrenThroughParentTrace() {
        store.add(entry("INFO", "scheduler", "cycle start", "cycle1", ""));
        store.add(entry("INFO", "scheduler", "item archived", "abc123def456", "cycle1"));
        store.add(entry("INFO", "scheduler", "other cycle", "cycle2", ""));

        List<LogEntry> found = store.query(LogQuery.builder().traceId("cycle1").build());

        assertThat(found).extracting(LogEntry::getMessage).containsExactly("item archived", "cycle start");
    }

    @Test
    void filtersCombineComponentLevelAndKeyword() {
        store.add(entry("INFO", "draft-expander", "draft done for twitter", "t1-twitter", "t1"));
        store.add(entry("ERROR", "draft-expander", "draft failed for zhihu", "t1-zhihu", "t1"));
        store.add(entry("ERROR", "scheduler", "feed failed", "c1", ""));

        List<LogEntry> found = store.query(LogQuery.builder()
                .component("DRAFT-EXPANDER").level("error").keyword("Zhihu").build());

        assertThat(found).extracting(LogEntry::getTraceId).containsExactly("t1-zhihu");
    }

    @Test
    void limitIsClampedToAllowedRange() {
        assertThat(LogQuery.builder().build().safeLimit()).isEqualTo(200);
        assertThat(LogQuery.builder().limit(0).build().safeLimit()).isEqualTo(1);
        assertThat(LogQuery.builder().limit(50_000).build().safeLimit()).isEqualTo(1000);

        store.add(entry("INFO", "scheduler", "a", "t", ""));
        store.add(entry("INFO", "scheduler", "b", "t", ""));
        assertThat(store.query(LogQuery.builder().limit(1).build())).extracting(LogEntry::getMessage).containsExactly("b");
    }

    private LogEntry entry(String level, String component, String message, String traceId, String parent) {
        return LogEntry.builder()
                .seq(store.nextSeq())
                .timestamp(Instant.now())
                .level(level)
                .logger("test")
                .component(component)
                .message(message)
                .traceId(traceId)
                .parentTraceId(parent)
                .requestId("")
                .thread("main")
                .build();
    }
}
