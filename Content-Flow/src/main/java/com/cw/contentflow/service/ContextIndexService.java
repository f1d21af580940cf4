package com.cw.contentflow.service;

import com.cw.contentflow.DTO.ContextResult;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.ContextNote;
import com.cw.contentflow.entity.RecordType;
import com.cw.contentflow.repository.ContentPackageRepository;
import com.cw.contentflow.repository.ContextNoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 과거 요약 검색 (증분 작성 컨텍스트)
 * 최근 200건을 키워드 겹침 수 → 최신순으로 랭킹. 정확도보다 "이미 다룬 내용 피하기"가 목적.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextIndexService {
    private final ContextNoteRepository noteRepo;
    private final ContentPackageRepository packageRepo;
    private final Clock clock;

    private static final Pattern TOKEN = Pattern.compile("[a-zA-Z0-9]{3,}|[\\u4e00-\\u9fff]{2,}|[\\uac00-\\ud7a3]{2,}");
    private static final DateTimeFormatter NOTE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int SNIPPET_LIMIT = 220;

    public ContextResult retrieve(List<String> keywords, int limit) {
        List<String> wanted = normalizeKeywords(keywords);
        if (wanted.isEmpty() || limit <= 0) return ContextResult.EMPTY;

        record Scored(ContextNote note, int score) {}
        List<Scored> scored = new ArrayList<>();
        for (ContextNote note : noteRepo.findTop200ByOrderByIdDesc()) {
            String haystack = (nullToEmpty(note.getKeywords()) + " " + nullToEmpty(note.getTitle())).toLowerCase(Locale.ROOT);
            int score = 0;
            for (String kw : wanted) {
                if (haystack.contains(kw)) score++;
            }
            if (score > 0) scored.add(new Scored(note, score));
        }
        if (scored.isEmpty()) return ContextResult.EMPTY;

        // 점수 내림차순, 같으면 최신(id 큰 것) 우선
        scored.sort(Comparator.comparingInt(Scored::score).reversed()
                .thenComparing(s -> s.note().getId(), Comparator.reverseOrder()));

        List<String> lines = new ArrayList<>();
        for (Scored s : scored.subList(0, Math.min(limit, scored.size()))) {
            ContextNote n = s.note();
            lines.add(String.format("- %s (%s): %s", n.getTitle(),
                    n.getCreatedAt() == null ? "" : n.getCreatedAt().format(NOTE_TIME), nullToEmpty(n.getSummary())));
        }
        log.debug("🔎 컨텍스트 검색: 키워드 {}개 → {}건 매칭", wanted.size(), lines.size());
        return new ContextResult(String.join("\n", lines), lines.size());
    }

    public ContextNote append(ContextNote note) {
        if (note.getCreatedAt() == null) {
            note.setCreatedAt(LocalDateTime.now(clock));
        }
        return noteRepo.save(note);
    }

    /**
     * 같은 제목/플랫폼의 과거 초안 스니펫 (초안 생성 시 중복 시각·문장 회피용)
     */
    public String draftHistory(String title, String platform, int limit) {
        List<String> tokens = extractTokens(title);
        if (tokens.isEmpty() || limit <= 0) return "";

        String platformKey = platform == null ? "" : platform.trim().toLowerCase(Locale.ROOT);
        List<String> snippets = new ArrayList<>();
        for (ContentPackage draft : packageRepo.findTop200ByRecordTypeOrderByIdDesc(RecordType.DRAFT)) {
            if (snippets.size() >= limit) break;
            String text = (nullToEmpty(draft.getTitle()) + " " + nullToEmpty(draft.getSummary()) + " "
                    + nullToEmpty(draft.getShortCopy()) + " " + nullToEmpty(draft.getLongArticle())).toLowerCase(Locale.ROOT);
            int score = 0;
            for (String token : tokens) {
                if (text.contains(token)) score++;
            }
            if (!platformKey.isEmpty() && platformKey.equalsIgnoreCase(draft.getPlatform())) score += 2;
            if (score <= 0) continue;

            String body = draft.getShortCopy() != null && !draft.getShortCopy().isBlank()
                    ? draft.getShortCopy() : nullToEmpty(draft.getLongArticle());
            snippets.add(String.format("- [%s] %s: %s", draft.getPlatform(), draft.getTitle(), oneLine(body)));
        }
        return String.join("\n", snippets);
    }

    public int sweep(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0: " + retentionDays);
        }
        int removed = noteRepo.deleteCreatedBefore(LocalDateTime.now(clock).minusDays(retentionDays));
        log.info("🧹 컨텍스트 노트 정리 완료: {}건 삭제 (보존 {}일)", removed, retentionDays);
        return removed;
    }

    static List<String> extractTokens(String text) {
        if (text == null) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find() && seen.size() < 10) {
            seen.add(m.group());
        }
        return new ArrayList<>(seen);
    }

    private static List<String> normalizeKeywords(List<String> keywords) {
        if (keywords == null) return List.of();
        Set<String> out = new LinkedHashSet<>();
        for (String kw : keywords) {
            if (kw == null) continue;
            String k = kw.trim().toLowerCase(Locale.ROOT);
            if (!k.isEmpty()) out.add(k);
        }
        return new ArrayList<>(out);
    }

    private static String oneLine(String text) {
        String compact = text.replaceAll("\\s+", " ").trim();
        return compact.substring(0, Math.min(SNIPPET_LIMIT, compact.length()));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
