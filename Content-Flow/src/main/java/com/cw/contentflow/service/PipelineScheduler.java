package com.cw.contentflow.service;

import com.cw.contentflow.DTO.CycleReport;
import com.cw.contentflow.DTO.RulesConfig;
import com.cw.contentflow.DTO.RulesSnapshot;
import com.cw.contentflow.DTO.SourceDescriptor;
import com.cw.contentflow.config.ContentFlowProperties;
import com.cw.contentflow.trace.MdcTaskDecorator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.*;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 파이프라인 스케줄러 (시간 주도 작업의 유일한 주인)
 *
 * - 소스별 고정 주기 타이머 (fetch_interval)
 * - 플랫폼별 일일 스케줄 (HH:MM, rules 타임존) → 전체 소스 1회
 * - 보존기간 정리 (기본 03:30, rules 타임존)
 * - rules 파일 감시 (지문 변경 시 리로드)
 * - 수동 트리거 / 리로드 / 상태 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineScheduler {
    private final HeartbeatService heartbeatService;
    private final RulesLoader rulesLoader;
    private final FingerprintStore fingerprintStore;
    private final ContextIndexService contextIndex;
    private final ThreadPoolTaskScheduler pipelineTaskScheduler;
    private final ContentFlowProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<String, SourceRuntime> runtimes = new ConcurrentHashMap<>();
    private final AtomicReference<RulesSnapshot> snapshot = new AtomicReference<>();
    private final List<ScheduledFuture<?>> globalJobs = new ArrayList<>();
    private final Object scheduleLock = new Object();
    private final MdcTaskDecorator mdcTaskDecorator = new MdcTaskDecorator();
    private volatile boolean timersActive = false;

    // 플랫폼 크론 + 보존기간 정리 + rules 감시 몫
    static final int RESERVED_THREADS = 2;

    @PostConstruct
    public void init() {
        try {
            apply(rulesLoader.load());
        } catch (RulesException e) {
            log.error("🚨 rules 초기 로드 실패 (소스 없이 시작): {}", e.getMessage());
            apply(new RulesSnapshot(new RulesConfig(), "", ZoneId.systemDefault(), LocalDateTime.now(clock)));
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (properties.getScheduler().isAutoStart()) {
            start();
        } else {
            log.info("⏸️ auto-start=false: 타이머 없이 수동 트리거만 동작");
        }
    }

    /**
     * 타이머 등록 (이미 걸려 있으면 다시 건다)
     */
    public void start() {
        synchronized (scheduleLock) {
            timersActive = true;
            rescheduleAll();
        }
    }

    public void stop() {
        synchronized (scheduleLock) {
            timersActive = false;
            cancelAll();
        }
        log.info("⏹️ 파이프라인 타이머 해제");
    }

    /**
     * 전체 소스 1회 (소스끼리는 병렬, weight 높은 순으로 제출). 모두 끝날 때까지 대기.
     */
    public List<CycleReport> runAllOnce() {
        RulesConfig rules = snapshot.get().getRules();
        List<CompletableFuture<CycleReport>> futures = new ArrayList<>();
        for (SourceRuntime runtime : orderedRuntimes()) {
            futures.add(CompletableFuture.supplyAsync(() -> heartbeatService.runCycle(runtime, rules), this::executeWithMdc));
        }
        List<CycleReport> reports = new ArrayList<>();
        for (CompletableFuture<CycleReport> future : futures) {
            reports.add(future.join());
        }
        log.info("▶️ 전체 수동 실행 완료: {}개 소스", reports.size());
        return reports;
    }

    /**
     * 스케줄 잡용. 제출만 하고 기다리지 않는다 (같은 풀 안에서 join 하지 않도록).
     */
    void submitAll(String reason) {
        RulesConfig rules = snapshot.get().getRules();
        log.info("⏰ 전체 소스 실행 ({})", reason);
        for (SourceRuntime runtime : orderedRuntimes()) {
            executeWithMdc(() -> heartbeatService.runCycle(runtime, rules));
        }
    }

    public CycleReport runSource(String sourceId) {
        SourceRuntime runtime = runtimes.get(sourceId);
        if (runtime == null || runtime.isRetired()) {
            throw new NoSuchElementException("unknown source: " + sourceId);
        }
        return heartbeatService.runCycle(runtime, snapshot.get().getRules());
    }

    /**
     * rules 다시 읽기. 실패하면 RulesException, 기존 rules/타이머는 그대로.
     */
    public Map<String, Object> reload() {
        RulesSnapshot loaded = rulesLoader.load();
        apply(loaded);
        return status();
    }

    /**
     * 보존기간 정리. retentionDays 가 null 이면 rules 의 memory_retention_days.
     */
    public Map<String, Object> sweep(Integer retentionDays) {
        int days = retentionDays != null ? retentionDays : snapshot.get().getRules().getGlobalConfig().getMemoryRetentionDays();
        int fingerprints = fingerprintStore.sweep(days);
        int notes = contextIndex.sweep(days);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("retentionDays", days);
        result.put("fingerprintsRemoved", fingerprints);
        result.put("notesRemoved", notes);
        return result;
    }

    /**
     * rules 파일 지문이 바뀌었으면 리로드. 실패는 로그만 (다음 주기에 다시 시도).
     */
    @Scheduled(fixedDelayString = "${contentflow.scheduler.rules-watch-interval-ms:60000}",
            initialDelayString = "${contentflow.scheduler.rules-watch-interval-ms:60000}")
    public void watchRules() {
        try {
            String current = rulesLoader.currentFingerprint();
            if (current.equals(snapshot.get().getFingerprint())) return;
            log.info("📜 rules 파일 변경 감지 → 리로드");
            apply(rulesLoader.load());
        } catch (RulesException e) {
            log.error("🚨 rules 감시/리로드 실패 (기존 rules 유지): {}", e.getMessage());
        }
    }

    public Map<String, Object> status() {
        RulesSnapshot current = snapshot.get();
        runtimes.entrySet().removeIf(e -> e.getValue().isRetired() && e.getValue().isIdle());

        List<Map<String, Object>> sources = new ArrayList<>();
        for (SourceRuntime runtime : orderedRuntimes()) {
            SourceDescriptor source = runtime.getDescriptor();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", source.getId());
            row.put("state", runtime.getState());
            row.put("transport", source.resolvedTransport());
            row.put("fetchInterval", source.getFetchInterval());
            row.put("weight", source.getWeight());
            row.put("lastRun", runtime.getLastRun());
            sources.add(row);
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("rulesFingerprint", current.getFingerprint());
        status.put("rulesLoadedAt", current.getLoadedAt());
        status.put("timezone", current.getZone().getId());
        status.put("timersActive", timersActive);
        status.put("platforms", current.getRules().enabledPlatforms());
        status.put("fingerprintCount", fingerprintStore.count());
        status.put("sources", sources);
        return status;
    }

    public RulesSnapshot currentRules() {
        return snapshot.get();
    }

    private void apply(RulesSnapshot loaded) {
        synchronized (scheduleLock) {
            snapshot.set(loaded);

            Set<String> incoming = new HashSet<>();
            for (SourceDescriptor source : loaded.getRules().getSources()) {
                incoming.add(source.getId());
                runtimes.compute(source.getId(), (id, existing) -> {
                    if (existing == null) return new SourceRuntime(source);
                    // 빠졌다가 다시 들어온 소스: 아직 사이클이 돌고 있을 수 있으니 같은 런타임을 되살린다
                    existing.setRetired(false);
                    existing.setDescriptor(source);
                    return existing;
                });
            }
            for (SourceRuntime runtime : runtimes.values()) {
                if (!incoming.contains(runtime.getDescriptor().getId())) {
                    runtime.setRetired(true);
                    runtime.cancelTimer();
                }
            }
            // 진행 중인 사이클은 끝까지 돌고, 빠진 소스는 idle 이 되면 status 에서 정리
            runtimes.entrySet().removeIf(e -> e.getValue().isRetired() && e.getValue().isIdle());
            resizePool(incoming.size());

            if (timersActive) {
                rescheduleAll();
            }
        }
    }

    private void rescheduleAll() {
        cancelAll();
        RulesSnapshot current = snapshot.get();
        Instant now = clock.instant();

        for (SourceRuntime runtime : runtimes.values()) {
            if (runtime.isRetired()) continue;
            SourceDescriptor source = runtime.getDescriptor();
            Duration interval = RulesLoader.parseInterval(source.getFetchInterval());
            String sourceId = source.getId();
            runtime.setTimer(pipelineTaskScheduler.scheduleAtFixedRate(() -> runScheduled(sourceId), now.plus(interval), interval));
            log.info("⏱️ 소스 타이머 등록: {} (every {})", sourceId, source.getFetchInterval());
        }

        current.getRules().getPlatforms().forEach((platform, policy) -> {
            if (policy == null || !policy.isEnabled() || policy.getSchedule() == null || policy.getSchedule().isBlank()) return;
            LocalTime at = RulesLoader.parseSchedule(policy.getSchedule());
            CronTrigger trigger = new CronTrigger(String.format("0 %d %d * * *", at.getMinute(), at.getHour()), current.getZone());
            globalJobs.add(pipelineTaskScheduler.schedule(() -> submitAll("platform:" + platform), trigger));
            log.info("⏱️ 플랫폼 일일 스케줄 등록: {} @ {} ({})", platform, policy.getSchedule(), current.getZone());
        });

        CronTrigger sweepTrigger = new CronTrigger(properties.getScheduler().getSweepCron(), current.getZone());
        globalJobs.add(pipelineTaskScheduler.schedule(this::scheduledSweep, sweepTrigger));
    }

    /**
     * 소스마다 스레드 1개 + 예비분. 설정값보다 작게 줄이지는 않는다.
     */
    private void resizePool(int sourceCount) {
        int size = Math.max(properties.getScheduler().getPoolSize(), sourceCount + RESERVED_THREADS);
        pipelineTaskScheduler.setPoolSize(size);
        log.info("🧵 파이프라인 풀 크기: {} (소스 {}개)", size, sourceCount);
    }

    /**
     * 호출 쪽 MDC(요청 trace 등)를 풀 스레드로 넘긴다. 타이머 틱은 각 사이클이 자기 trace 를 연다.
     */
    private void executeWithMdc(Runnable task) {
        pipelineTaskScheduler.execute(mdcTaskDecorator.decorate(task));
    }

    private void cancelAll() {
        runtimes.values().forEach(SourceRuntime::cancelTimer);
        globalJobs.forEach(job -> {
            if (job != null) job.cancel(false);
        });
        globalJobs.clear();
    }

    private void runScheduled(String sourceId) {
        SourceRuntime runtime = runtimes.get(sourceId);
        if (runtime == null || runtime.isRetired()) return;
        heartbeatService.runCycle(runtime, snapshot.get().getRules());
    }

    private void scheduledSweep() {
        try {
            sweep(null);
        } catch (RuntimeException e) {
            log.error("🚨 보존기간 정리 실패: {}", e.getMessage(), e);
        }
    }

    private List<SourceRuntime> orderedRuntimes() {
        List<SourceRuntime> ordered = new ArrayList<>();
        for (SourceRuntime runtime : runtimes.values()) {
            if (!runtime.isRetired()) ordered.add(runtime);
        }
        ordered.sort(Comparator.comparingInt((SourceRuntime r) -> r.getDescriptor().getWeight()).reversed()
                .thenComparing(r -> r.getDescriptor().getId()));
        return ordered;
    }
}
