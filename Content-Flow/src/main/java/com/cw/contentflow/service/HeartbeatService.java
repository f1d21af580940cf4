package com.cw.contentflow.service;

import com.cw.contentflow.DTO.ArchiveReceipt;
import com.cw.contentflow.DTO.ContextResult;
import com.cw.contentflow.DTO.CycleReport;
import com.cw.contentflow.DTO.NormalizedItem;
import com.cw.contentflow.DTO.RulesConfig;
import com.cw.contentflow.DTO.SourceDescriptor;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.ContextNote;
import com.cw.contentflow.entity.RecordType;
import com.cw.contentflow.trace.TraceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 소스 1개 하트비트: 스캔 → 중복 제거 → 신호 필터 → 아카이브 → 기억
 *
 * - 같은 소스는 동시에 한 사이클만 (IDLE → SCANNING CAS 선점)
 * - 아이템 단위 실패는 failed 카운트만 올리고 사이클은 계속
 * - 아카이브 성공 후에만 핑거프린트를 기록 (실패한 아이템은 다음 스캔에서 다시 처리)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HeartbeatService {
    private final FeedService feedService;
    private final FingerprintStore fingerprintStore;
    private final SignalFilter signalFilter;
    private final ContextIndexService contextIndex;
    private final ArchiveService archiveService;
    private final Clock clock;

    static final String COMPONENT = "scheduler";
    static final List<String> DEFAULT_CHANNELS = List.of("twitter", "wechat_blog");

    private static final int TOPIC_SUMMARY_LIMIT = 240;
    private static final int CONTEXT_LIMIT = 3;

    public CycleReport runCycle(SourceRuntime runtime, RulesConfig rules) {
        SourceDescriptor source = runtime.getDescriptor();
        if (!runtime.tryStart()) {
            log.info("⏭️ 이미 실행 중인 소스, 건너뜀: {} ({})", source.getId(), runtime.getState());
            return CycleReport.skipped(source.getId(), LocalDateTime.now(clock));
        }

        CycleReport report = CycleReport.builder()
                .sourceId(source.getId())
                .traceId(TraceContext.newTraceId())
                .startedAt(LocalDateTime.now(clock))
                .build();

        try (TraceContext.Scope ignored = TraceContext.open(report.getTraceId(), COMPONENT)) {
            log.info("💓 하트비트 시작: {}", source.getId());
            try {
                List<NormalizedItem> items = feedService.fetch(source);
                report.setScanned(items.size());
                for (NormalizedItem item : items) {
                    processItem(runtime, source, item, rules, report);
                }
                report.setOutcome(CycleReport.Outcome.COMPLETED);
            } catch (RuntimeException e) {
                report.setOutcome(CycleReport.Outcome.FAILED);
                report.setError(e.getMessage());
                log.error("❌ 소스 스캔 실패: {} - {}", source.getId(), e.getMessage());
            } finally {
                report.setEndedAt(LocalDateTime.now(clock));
                runtime.setLastRun(report);
                runtime.finish();
            }
            log.info("💓 하트비트 종료: {} scanned={} processed={} dup={} filtered={} failed={}",
                    source.getId(), report.getScanned(), report.getProcessed(), report.getDuplicated(),
                    report.getFiltered(), report.getFailed());
        }
        return report;
    }

    private void processItem(SourceRuntime runtime, SourceDescriptor source, NormalizedItem item,
                             RulesConfig rules, CycleReport report) {
        if (item.getFingerprint() == null || item.getFingerprint().isBlank()) {
            item.setFingerprint(ContentHash.fingerprint(item.getUrl(), item.getTitle()));
        }
        String fingerprint = item.getFingerprint();

        try (TraceContext.Scope ignored = TraceContext.openChild(topicTraceId(fingerprint), COMPONENT)) {
            runtime.advance(SourceState.DEDUPING);
            if (fingerprintStore.isDuplicate(fingerprint)) {
                report.setDuplicated(report.getDuplicated() + 1);
                log.debug("🔁 중복 아이템 스킵: {}", item.getTitle());
                return;
            }

            runtime.advance(SourceState.FILTERING);
            if (!signalFilter.isHighValue(item, rules.getFilter())) {
                report.setFiltered(report.getFiltered() + 1);
                log.debug("🚫 저가치 신호 필터: {}", item.getTitle());
                return;
            }

            runtime.advance(SourceState.ARCHIVING);
            List<String> keywords = keywordsOf(item);
            ContextResult context = contextIndex.retrieve(keywords, CONTEXT_LIMIT);
            ContentPackage topic = buildTopic(source, item, rules, context);
            ArchiveReceipt receipt = archiveService.archive(topic);

            runtime.advance(SourceState.REMEMBERING);
            if (!fingerprintStore.remember(fingerprint, source.getId())) {
                log.info("🔁 다른 사이클이 먼저 기록한 아이템 (아카이브는 완료): {}", topic.getTraceId());
            }
            contextIndex.append(ContextNote.builder()
                    .fingerprint(fingerprint)
                    .sourceId(source.getId())
                    .title(item.getTitle())
                    .url(item.getUrl())
                    .summary(topic.getSummary())
                    .keywords(String.join(",", keywords))
                    .archiveUrl(receipt.getDocUrl())
                    .imageUrl(topic.firstImageUrl())
                    .build());

            report.setProcessed(report.getProcessed() + 1);
            log.info("✅ 토픽 아카이브: [{}] {} ({})", topic.getTraceId(), item.getTitle(), receipt.getBackend());
        } catch (RuntimeException e) {
            report.setFailed(report.getFailed() + 1);
            log.error("❌ 아이템 처리 실패: {} - {}", item.getTitle(), e.getMessage());
        }
    }

    private ContentPackage buildTopic(SourceDescriptor source, NormalizedItem item, RulesConfig rules, ContextResult context) {
        String summary = item.getSummary() != null && !item.getSummary().isBlank() ? item.getSummary() : item.getRawText();
        List<String> channels = rules.enabledPlatforms();
        List<String> images = item.getImages() == null ? List.of() : item.getImages();

        return ContentPackage.builder()
                .recordType(RecordType.TOPIC)
                .traceId(topicTraceId(item.getFingerprint()))
                .sourceId(source.getId())
                .sourceInfo(sourceInfo(source.getId()))
                .fingerprint(item.getFingerprint())
                .title(item.getTitle())
                .summary(truncate(summary, TOPIC_SUMMARY_LIMIT))
                .sourceUrl(item.getUrl())
                .relatedContext(context.getContext())
                .channels(new ArrayList<>(channels.isEmpty() ? DEFAULT_CHANNELS : channels))
                .imageUrls(new ArrayList<>(images.subList(0, Math.min(3, images.size()))))
                .status(ContentPackage.STATUS_PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    /**
     * 토픽 trace = 핑거프린트 앞 12자리. 초안은 여기에 -{platform} 이 붙는다.
     */
    static String topicTraceId(String fingerprint) {
        return fingerprint.substring(0, Math.min(12, fingerprint.length()));
    }

    /**
     * 소스 id → 표시용 출처 (twitter_openai_live → twitter-openai)
     */
    static String sourceInfo(String sourceId) {
        String raw = sourceId == null ? "" : sourceId.trim().toLowerCase(Locale.ROOT);
        if (raw.isEmpty()) return "unknown-unknown";
        if (raw.startsWith("twitter_")) return "twitter-" + raw.substring("twitter_".length()).replace("_live", "");
        if (raw.startsWith("wechat_")) return "wechat-" + raw.substring("wechat_".length()).replace("_live", "");
        if (raw.startsWith("xhs_")) return "xiaohongshu-" + raw.substring("xhs_".length()).replace("_live", "");
        if (raw.contains("xiaohongshu")) return "xiaohongshu-" + raw.replace("xiaohongshu_", "").replace("_live", "");
        return raw;
    }

    private static List<String> keywordsOf(NormalizedItem item) {
        List<String> keywords = new ArrayList<>();
        if (item.getKeywords() != null) {
            for (String kw : item.getKeywords()) {
                if (kw != null && !kw.isBlank()) keywords.add(kw.trim().toLowerCase(Locale.ROOT));
            }
        }
        return keywords.isEmpty() ? ContextIndexService.extractTokens(item.getTitle()) : keywords;
    }

    private static String truncate(String text, int limit) {
        if (text == null) return "";
        return text.length() <= limit ? text : text.substring(0, limit);
    }
}
