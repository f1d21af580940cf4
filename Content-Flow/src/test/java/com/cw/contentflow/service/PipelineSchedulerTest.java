package com.cw.contentflow.service;

import com.cw.contentflow.DTO.CycleReport;
import com.cw.contentflow.config.ContentFlowProperties;
import com.cw.contentflow.entity.RecordType;
import com.cw.contentflow.repository.ContentPackageRepository;
import com.cw.contentflow.trace.LogEntry;
import com.cw.contentflow.trace.LogQuery;
import com.cw.contentflow.trace.LogStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class PipelineSchedulerTest {

    static final String SOURCE = "fixture_ai_news";
    static final int ELIGIBLE_ITEMS = 3;

    @Autowired
    PipelineScheduler pipelineScheduler;
    @Autowired
    FingerprintStore fingerprintStore;
    @Autowired
    ContentPackageRepository packageRepo;
    @Autowired
    ContentFlowProperties properties;
    @Autowired
    LogStore logStore;
    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM CF_FINGERPRINT");
        jdbcTemplate.update("DELETE FROM CF_CONTEXT_NOTE");
        jdbcTemplate.update("DELETE FROM CF_CONTENT_PACKAGE");
    }

    @AfterEach
    void restoreRules() {
        properties.setRulesPath("classpath:rules-test.yaml");
        pipelineScheduler.reload();
    }

    @Test
    void concurrentManualTriggersArchiveEachEligibleItemOnce() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<CycleReport> reports = new ArrayList<>();
        try {
            List<Future<List<CycleReport>>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(callers.submit(() -> {
                    start.await();
                    return pipelineScheduler.runAllOnce();
                }));
            }
            start.countDown();
            for (Future<List<CycleReport>> f : futures) {
                reports.addAll(f.get(30, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(packageRepo.countByRecordType(RecordType.TOPIC)).isEqualTo(ELIGIBLE_ITEMS);
        assertThat(fingerprintStore.count()).isEqualTo(ELIGIBLE_ITEMS);
        assertThat(reports).hasSize(2);
        assertThat(reports.stream().mapToInt(CycleReport::getProcessed).sum()).isEqualTo(ELIGIBLE_ITEMS);
        assertThat(reports).extracting(CycleReport::getOutcome)
                .containsAnyOf(CycleReport.Outcome.COMPLETED)
                .doesNotContain(CycleReport.Outcome.FAILED);
    }

    @Test
    void sweepZeroMakesRememberedItemsNewAgain() {
        CycleReport first = pipelineScheduler.runSource(SOURCE);
        assertThat(first.getScanned()).isEqualTo(4);
        assertThat(first.getFiltered()).isEqualTo(1);
        assertThat(first.getProcessed()).isEqualTo(ELIGIBLE_ITEMS);

        CycleReport second = pipelineScheduler.runSource(SOURCE);
        assertThat(second.getDuplicated()).isEqualTo(4 - 1);
        assertThat(second.getProcessed()).isZero();

        Map<String, Object> swept = pipelineScheduler.sweep(0);
        assertThat(swept.get("fingerprintsRemoved")).isEqualTo(ELIGIBLE_ITEMS);

        CycleReport third = pipelineScheduler.runSource(SOURCE);
        assertThat(third.getProcessed()).isEqualTo(ELIGIBLE_ITEMS);
        assertThat(packageRepo.countByRecordType(RecordType.TOPIC)).isEqualTo(2L * ELIGIBLE_ITEMS);
    }

    @Test
    void cycleLogsAreQueryableByCycleTrace() {
        CycleReport report = pipelineScheduler.runSource(SOURCE);

        List<LogEntry> entries = logStore.query(LogQuery.builder().traceId(report.getTraceId()).build());

        assertThat(entries).isNotEmpty();
        assertThat(entries).extracting(LogEntry::getComponent).containsOnly("scheduler");
        // 아이템 로그는 자식 trace, 부모가 사이클 trace
        assertThat(entries).anySatisfy(e -> assertThat(e.getParentTraceId()).isEqualTo(report.getTraceId()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void reloadSwapsSourcesAndKeepsPreviousRulesOnFailure() {
        properties.setRulesPath("classpath:rules-reload.yaml");
        Map<String, Object> status = pipelineScheduler.reload();

        List<Map<String, Object>> sources = (List<Map<String, Object>>) status.get("sources");
        assertThat(sources).extracting(row -> row.get("id")).containsExactly("fixture_second_feed", SOURCE);
        assertThat(status.get("timezone")).isEqualTo("UTC");
        assertThat(status.get("platforms")).isEqualTo(List.of("zhihu"));

        properties.setRulesPath("classpath:rules-invalid.yaml");
        assertThatThrownBy(() -> pipelineScheduler.reload()).isInstanceOf(RulesException.class);
        assertThat(pipelineScheduler.currentRules().getZone().getId()).isEqualTo("UTC");
        assertThat(pipelineScheduler.currentRules().getRules().getSources()).hasSize(2);
    }

    @Test
    void unknownSourceIsRejected() {
        assertThatThrownBy(() -> pipelineScheduler.runSource("missing"))
                .isInstanceOf(NoSuchElementException.class);
    }
}
