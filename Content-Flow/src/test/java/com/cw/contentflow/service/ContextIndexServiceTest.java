package com.cw.contentflow.service;

import com.cw.contentflow.DTO.ContextResult;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.ContextNote;
import com.cw.contentflow.entity.RecordType;
import com.cw.contentflow.repository.ContentPackageRepository;
import com.cw.contentflow.repository.ContextNoteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContextIndexServiceTest {

    @Mock
    ContextNoteRepository noteRepo;
    @Mock
    ContentPackageRepository packageRepo;

    Clock clock = Clock.fixed(Instant.parse("2026-10-05T10:00:00Z"), ZoneOffset.UTC);
    ContextIndexService contextIndex;

    @BeforeEach
    void setUp() {
        contextIndex = new ContextIndexService(noteRepo, packageRepo, clock);
    }

    @Test
    void retrieveRanksByOverlapThenRecency() {
        LocalDateTime at = LocalDateTime.of(2026, 10, 1, 9, 0);
        when(noteRepo.findTop200ByOrderByIdDesc()).thenReturn(List.of(
                note(3L, "Newest agent note", "agent", at),
                note(2L, "Agent benchmark roundup", "agent,benchmark", at),
                note(1L, "Unrelated cooking story", "food", at)));

        ContextResult result = contextIndex.retrieve(List.of("Agent", "benchmark"), 5);

        assertThat(result.getMatchedCount()).isEqualTo(2);
        assertThat(result.getContext().split("\n"))
                .containsExactly(
                        "- Agent benchmark roundup (2026-10-01 09:00): summary of 2",
                        "- Newest agent note (2026-10-01 09:00): summary of 3");
    }

    @Test
    void emptyKeywordsGiveEmptyResult() {
        assertThat(contextIndex.retrieve(List.of(), 3)).isEqualTo(ContextResult.EMPTY);
        assertThat(contextIndex.retrieve(List.of("  "), 3).getMatchedCount()).isZero();
        verifyNoInteractions(noteRepo);
    }

    @Test
    void appendStampsCreationTime() {
        when(noteRepo.save(any(ContextNote.class))).thenAnswer(inv -> inv.getArgument(0));

        ContextNote saved = contextIndex.append(ContextNote.builder().title("t").build());

        assertThat(saved.getCreatedAt()).isEqualTo(LocalDateTime.now(clock));
    }

    @Test
    void draftHistoryPrefersSamePlatformAndCapsSnippets() {
        String longArticle = "word ".repeat(100);
        when(packageRepo.findTop200ByRecordTypeOrderByIdDesc(RecordType.DRAFT)).thenReturn(List.of(
                draft("zhihu", "Unrelated post", null, longArticle),
                draft("twitter", "Something else", "short copy", null),
                draft("twitter", "Model release notes", "model is out", null)));

        String history = contextIndex.draftHistory("New model release", "twitter", 5);

        List<String> lines = List.of(history.split("\n"));
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).isEqualTo("- [twitter] Something else: short copy");
        assertThat(lines.get(1)).isEqualTo("- [twitter] Model release notes: model is out");
    }

    @Test
    void draftHistorySnippetIsOneLineOfAtMost220Chars() {
        when(packageRepo.findTop200ByRecordTypeOrderByIdDesc(RecordType.DRAFT)).thenReturn(List.of(
                draft("zhihu", "Model deep dive", null, "line one\nline two " + "x".repeat(400))));

        String history = contextIndex.draftHistory("model", "twitter", 5);

        String snippet = history.substring("- [zhihu] Model deep dive: ".length());
        assertThat(snippet).doesNotContain("\n").hasSize(220).startsWith("line one line two");
    }

    @Test
    void sweepDeletesNotesAtOrBeforeCutoff() {
        when(noteRepo.deleteCreatedBefore(LocalDateTime.now(clock).minusDays(7))).thenReturn(4);

        assertThat(contextIndex.sweep(7)).isEqualTo(4);
    }

    private static ContextNote note(Long id, String title, String keywords, LocalDateTime createdAt) {
        return ContextNote.builder()
                .id(id)
                .title(title)
                .keywords(keywords)
                .summary("summary of " + id)
                .createdAt(createdAt)
                .build();
    }

    private static ContentPackage draft(String platform, String title, String shortCopy, String article) {
        return ContentPackage.builder()
                .recordType(RecordType.DRAFT)
                .traceId("t-" + platform)
                .platform(platform)
                .title(title)
                .shortCopy(shortCopy)
                .longArticle(article)
                .build();
    }
}
