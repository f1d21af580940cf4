package com.cw.contentflow.service;

import com.cw.contentflow.DTO.*;
import com.cw.contentflow.config.ContentFlowProperties;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.RecordType;
import com.cw.contentflow.repository.ContentPackageRepository;
import com.cw.contentflow.trace.TraceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * 확인 이벤트 → 플랫폼별 초안 확장
 *
 * 1. 핸드셰이크(url_verification) 는 challenge 만 돌려줌
 * 2. 트리거 상태가 아니면 무시, 제목/채널 없으면 거절 (부분 작업 없음)
 * 3. 플랫폼마다 독립적으로 생성 → 이미지 → 아카이브. 한 플랫폼 실패가 다른 플랫폼에 영향 없음
 * 4. (topic, platform) 당 초안 1개: 생성 중이면 SKIPPED_IN_FLIGHT, 이미 있으면 SKIPPED_EXISTING
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftExpanderService {
    private final CallbackPayloadParser parser;
    private final ContextIndexService contextIndex;
    private final GenerationService generationService;
    private final ImageService imageService;
    private final ArchiveService archiveService;
    private final ContentPackageRepository packageRepo;
    private final PipelineScheduler pipelineScheduler;
    private final ContentFlowProperties properties;
    private final Clock clock;
    @Qualifier("draftTaskExecutor")
    private final TaskExecutor draftTaskExecutor;

    static final String COMPONENT = "draft-expander";
    static final String CALLBACK_SOURCE_ID = "confirmation_callback";
    private static final int ERROR_LIMIT = 200;

    // 생성 중인 초안 trace (같은 콜백이 생성 도중 다시 들어와도 한 번만 생성)
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ExpansionResult handle(Map<String, Object> payload, boolean force) {
        if (parser.isHandshake(payload)) {
            log.info("🤝 콜백 핸드셰이크");
            return ExpansionResult.handshake(parser.challenge(payload));
        }

        Optional<Map<String, Object>> fields = parser.locateFields(payload);
        if (fields.isEmpty()) {
            log.info("🙈 콜백 무시: fields 없음");
            return ExpansionResult.ignored("fields_not_found");
        }

        ConfirmationEvent event = parser.parse(fields.get());
        if (!CallbackPayloadParser.isTrigger(event.getStatus())) {
            log.debug("🙈 콜백 무시: 트리거 상태 아님 ({})", event.getStatus());
            return ExpansionResult.ignored("status_not_confirmed");
        }
        if (event.getTitle().isEmpty()) {
            log.warn("⚠️ 콜백 거절: 제목 없음");
            return ExpansionResult.rejected("missing_title");
        }
        if (event.getChannels().isEmpty()) {
            log.warn("⚠️ 콜백 거절: 발행 채널 없음 ({})", event.getTitle());
            return ExpansionResult.rejected("missing_channels");
        }

        log.info("📨 확인 이벤트 → topic trace {} (request trace {})", event.getTopicTraceId(), TraceContext.currentTraceId());
        try (TraceContext.Scope ignored = TraceContext.openChild(event.getTopicTraceId(), COMPONENT)) {
            return expand(event, force);
        }
    }

    private ExpansionResult expand(ConfirmationEvent event, boolean force) {
        log.info("🚀 초안 확장 시작: {} → {}", event.getTitle(), event.getChannels());
        RulesConfig rules = pipelineScheduler.currentRules().getRules();

        List<CompletableFuture<PlatformResult>> futures = new ArrayList<>();
        for (String platform : event.getChannels()) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> expandPlatform(event, platform, rules, force), draftTaskExecutor));
            } catch (RejectedExecutionException e) {
                log.error("❌ 초안 작업 큐 포화: {}", platform);
                futures.add(CompletableFuture.completedFuture(failed(event, platform, "draft queue full")));
            }
        }

        List<PlatformResult> results = new ArrayList<>();
        for (CompletableFuture<PlatformResult> future : futures) {
            results.add(future.join());
        }
        int generated = (int) results.stream().filter(r -> r.getStatus() == PlatformResult.Status.SUCCEEDED).count();
        log.info("🏁 초안 확장 완료: {} 성공 {}/{}", event.getTopicTraceId(), generated, results.size());

        return ExpansionResult.builder()
                .status(ExpansionResult.Status.ACCEPTED)
                .topicTraceId(event.getTopicTraceId())
                .generatedCount(generated)
                .results(results)
                .build();
    }

    private PlatformResult expandPlatform(ConfirmationEvent event, String platform, RulesConfig rules, boolean force) {
        String traceId = event.getTopicTraceId() + "-" + platform;
        try (TraceContext.Scope ignored = TraceContext.openChild(traceId, COMPONENT)) {
            if (!inFlight.add(traceId)) {
                log.info("⏭️ 같은 초안이 생성 중, 건너뜀: {}", traceId);
                return PlatformResult.builder()
                        .platform(platform).traceId(traceId).status(PlatformResult.Status.SKIPPED_IN_FLIGHT).build();
            }
            try {
                if (!force && packageRepo.existsByTraceIdAndRecordType(traceId, RecordType.DRAFT)) {
                    log.info("⏭️ 이미 생성된 초안, 건너뜀: {}", traceId);
                    return PlatformResult.builder()
                            .platform(platform).traceId(traceId).status(PlatformResult.Status.SKIPPED_EXISTING).build();
                }

                String history = contextIndex.draftHistory(event.getTitle(), platform, properties.getDrafts().getHistoryLimit());
                String historyContext = history.isEmpty() ? "" : "以下是历史草稿片段，请避免重复视角和重复句式：\n" + history;
                PlatformProfile profile = PlatformProfile.of(platform, rules);

                String seed = (event.getSummary().isEmpty() ? event.getTitle() : event.getSummary()) + "\n"
                        + "写作要求：" + profile.getTone() + "。必须基于事实，不要杜撰来源；结尾给出明确观点或行动建议。";
                ThinkResult think = generationService.think(event.getTitle(), seed, historyContext, profile.toStrategy());

                String basePrompt = think.getImagePrompt() == null || think.getImagePrompt().isBlank()
                        ? event.getTitle() : think.getImagePrompt();
                List<String> imageUrls = new ArrayList<>();
                for (int i = 0; i < profile.getImageCount(); i++) {
                    String prompt = i == 0 ? basePrompt : basePrompt + ". variation " + (i + 1);
                    imageUrls.add(imageService.paint(prompt, profile.getRatio()));
                }

                ContentPackage draft = ContentPackage.builder()
                        .recordType(RecordType.DRAFT)
                        .traceId(traceId)
                        .topicTraceId(event.getTopicTraceId())
                        .platform(platform)
                        .sourceId(CALLBACK_SOURCE_ID)
                        .sourceInfo(event.getSourceInfo())
                        .title(event.getTitle())
                        .summary(think.getAiSummary() == null || think.getAiSummary().isBlank() ? event.getSummary() : think.getAiSummary())
                        .sourceUrl(event.getSourceUrl())
                        .channels(new ArrayList<>(List.of(platform)))
                        .status(ContentPackage.STATUS_DRAFT_READY)
                        .shortCopy(think.getTwitterDraft())
                        .longArticle(think.getArticleMarkdown())
                        .imagePrompt(basePrompt)
                        .imageUrls(imageUrls)
                        .createdAt(LocalDateTime.now(clock))
                        .build();
                ArchiveReceipt receipt = archiveService.archive(draft);

                log.info("✅ 초안 완료 [{}] {}", platform, receipt.getDocUrl());
                return PlatformResult.builder()
                        .platform(platform)
                        .traceId(traceId)
                        .status(PlatformResult.Status.SUCCEEDED)
                        .docUrl(receipt.getDocUrl())
                        .backend(receipt.getBackend())
                        .build();
            } catch (RuntimeException e) {
                log.error("❌ 초안 생성 실패 [{}]: {}", platform, e.getMessage(), e);
                return failed(event, platform, e.getMessage());
            } finally {
                inFlight.remove(traceId);
            }
        }
    }

    private static PlatformResult failed(ConfirmationEvent event, String platform, String error) {
        String message = error == null ? "unknown error" : error;
        return PlatformResult.builder()
                .platform(platform)
                .traceId(event.getTopicTraceId() + "-" + platform)
                .status(PlatformResult.Status.FAILED)
                .error(message.length() > ERROR_LIMIT ? message.substring(0, ERROR_LIMIT) : message)
                .build();
    }
}
