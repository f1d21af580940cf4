package com.cw.contentflow.service;

import com.cw.contentflow.DTO.NormalizedItem;
import com.cw.contentflow.DTO.SourceDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정적 파일(file:, classpath:) RSS/Atom 피드 파서.
 * 네트워크 소스는 피드 워커가 하고, 로컬 픽스처·미러 파일만 여기서 읽는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaticFeedReader {
    private final ResourceLoader resourceLoader;

    private static final List<String> TITLE_BLOCKED = List.of("sponsored", "ad:");
    private static final List<String> TEXT_BLOCKED = List.of("广告", "招聘", "推广", "商务合作", "欢迎关注", "点击原文");
    private static final Pattern KEYWORD = Pattern.compile("[A-Za-z]{3,}|[\\u4e00-\\u9fff]{2,}|[\\uac00-\\ud7a3]{2,}");
    private static final Pattern ONLY_URL = Pattern.compile("https?://\\S+");

    public List<NormalizedItem> read(SourceDescriptor source) throws IOException {
        Resource resource = resourceLoader.getResource(source.getUrl());
        String xml;
        try (InputStream in = resource.getInputStream()) {
            xml = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return parse(xml, source);
    }

    List<NormalizedItem> parse(String xml, SourceDescriptor source) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        List<NormalizedItem> results = new ArrayList<>();
        int noise = 0;

        for (Element item : doc.select("item, entry")) {
            if (results.size() >= source.getMaxItems()) break;

            String title = item.select("> title").text().trim();
            String link = item.select("> link").text().trim();
            if (link.isEmpty()) {
                // Atom feed: <link href="..."/>
                link = item.select("> link").attr("href").trim();
            }
            String pubDate = item.select("> pubDate, > published, > updated").text().trim();
            String description = item.select("> description, > summary").text();
            String encoded = item.select("> content|encoded, > content").text();

            String rawText = cleanText(encoded);
            if (rawText.isEmpty()) rawText = cleanText(description);
            if (rawText.isEmpty()) rawText = title;

            if (isNoise(title, rawText, source)) {
                noise++;
                continue;
            }

            List<String> images = extractImages(encoded);
            if (images.isEmpty()) images = extractImages(description);
            for (Element enclosure : item.select("> enclosure[type^=image]")) {
                String url = enclosure.attr("url").trim();
                if (!url.isEmpty()) images.add(url);
            }

            String summary = rawText;
            results.add(NormalizedItem.builder()
                    .sourceId(source.getId())
                    .fingerprint(ContentHash.fingerprint(link, title))
                    .title(truncate(title, 300))
                    .url(link)
                    .summary(truncate(summary, 180))
                    .rawText(truncate(rawText, 12_000))
                    .publishedAt(pubDate.isEmpty() ? null : pubDate)
                    .images(new ArrayList<>(images.subList(0, Math.min(6, images.size()))))
                    .keywords(extractKeywords(title, rawText, 8))
                    .build());
        }
        log.debug("📰 정적 피드 파싱 [{}]: {}건 (노이즈 {}건 제외)", source.getId(), results.size(), noise);
        return results;
    }

    private boolean isNoise(String title, String rawText, SourceDescriptor source) {
        if (title.length() < source.getMinTitleLength()) return true;
        String plain = rawText.replace("\n", " ").trim();
        if (plain.isEmpty() || ONLY_URL.matcher(plain).matches() || ONLY_URL.matcher(title).matches()) return true;

        String lowerTitle = title.toLowerCase(Locale.ROOT);
        String lowerText = plain.toLowerCase(Locale.ROOT);
        for (String word : TITLE_BLOCKED) {
            if (lowerTitle.contains(word)) return true;
        }
        List<String> blocked = new ArrayList<>(TEXT_BLOCKED);
        if (source.getBlockedWords() != null) blocked.addAll(source.getBlockedWords());
        for (String word : blocked) {
            String w = word.toLowerCase(Locale.ROOT);
            if (lowerTitle.contains(w) || lowerText.contains(w)) return true;
        }
        return false;
    }

    private static String cleanText(String htmlOrText) {
        if (htmlOrText == null || htmlOrText.isBlank()) return "";
        String text = htmlOrText.trim();
        if (!text.contains("<") && !text.contains(">")) return text;
        return Jsoup.parse(text).text().trim();
    }

    private static List<String> extractImages(String html) {
        List<String> images = new ArrayList<>();
        if (html == null || !html.contains("<img")) return images;
        for (Element img : Jsoup.parse(html).select("img[src]")) {
            String src = img.attr("src").trim();
            if (!src.isEmpty()) images.add(src);
        }
        return images;
    }

    static List<String> extractKeywords(String title, String text, int limit) {
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = KEYWORD.matcher(title + " " + text);
        while (m.find() && seen.size() < limit) {
            seen.add(m.group().toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(seen);
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
