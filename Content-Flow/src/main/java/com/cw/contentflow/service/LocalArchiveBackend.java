package com.cw.contentflow.service;

import com.cw.contentflow.config.ContentFlowProperties;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.RecordType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 로컬 마크다운 아카이브 (원격 저장소 장애 시 최종 fallback)
 * {localDir}/{yyyy-MM-dd}/{topic_pool|draft_pool}/{date}-{trace}[-{platform}]-{title}.md
 */
@Slf4j
@Order(2)
@Component
@RequiredArgsConstructor
public class LocalArchiveBackend implements ArchiveBackend {
    private final ContentFlowProperties properties;
    private final Clock clock;

    static final String URL_PREFIX = "/local-archive/";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    @Override
    public String name() {
        return "LOCAL";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String write(ContentPackage pack) {
        LocalDateTime now = LocalDateTime.now(clock);
        String day = now.format(DAY);
        String bucket = pack.getRecordType().bucket();
        String traceId = safeFilePart(pack.getTraceId(), 64, "untraced");
        String title = safeFilePart(pack.getTitle(), 42, "untitled");
        String fileName = pack.getRecordType() == RecordType.TOPIC
                ? String.format("%s-%s-%s.md", day, traceId, title)
                : String.format("%s-%s-%s-%s.md", day, traceId, safeFilePart(pack.getPlatform(), 24, "general"), title);

        Path dir = Path.of(properties.getArchive().getLocalDir(), day, bucket);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(fileName), String.join("\n", markdown(pack, now)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("local archive write failed: " + dir.resolve(fileName), e);
        }

        String base = properties.getArchive().getPublicBaseUrl();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base + URL_PREFIX + day + "/" + bucket + "/" + fileName;
    }

    static List<String> markdown(ContentPackage pack, LocalDateTime now) {
        List<String> body = new ArrayList<>();
        body.add("# " + orDefault(pack.getTitle(), "Untitled"));
        body.add("");
        body.add("- Archived At: " + now);
        body.add("- Trace ID: " + orDefault(pack.getTraceId(), ""));
        if (pack.getRecordType() == RecordType.TOPIC) {
            body.add("- Source URL: " + orDefault(pack.getSourceUrl(), ""));
            body.add("- Source: " + orDefault(pack.getSourceInfo(), ""));
            body.add("- Suggested Platforms: " + String.join(", ", pack.getChannels()));
            body.add("");
            body.add("## 摘要");
            body.add(orDefault(pack.getSummary(), ""));
            body.add("");
            if (pack.getRelatedContext() != null && !pack.getRelatedContext().isBlank()) {
                body.add("## Related");
                body.add(pack.getRelatedContext());
                body.add("");
            }
            return body;
        }

        body.add("- Platform: " + orDefault(pack.getPlatform(), "general"));
        body.add("- Source URL: " + orDefault(pack.getSourceUrl(), ""));
        body.add("");
        body.add("## AI Summary");
        body.add(orDefault(pack.getSummary(), ""));
        body.add("");
        if (pack.getShortCopy() != null && !pack.getShortCopy().isBlank()) {
            body.add("## Short Copy");
            body.add(pack.getShortCopy());
            body.add("");
        }
        body.add("## Article");
        body.add(orDefault(pack.getLongArticle(), ""));
        body.add("");
        body.add("## Images");
        if (pack.getImageUrls().isEmpty()) {
            body.add("- (none)");
        } else {
            pack.getImageUrls().forEach(url -> body.add("- " + url));
        }
        body.add("");
        return body;
    }

    static String safeFilePart(String value, int maxLength, String fallback) {
        String cleaned = value == null ? "" : value.trim()
                .replaceAll("[\\\\/:*?\"<>|#%&{}$!'@`=+]", "")
                .replaceAll("\\s+", "-");
        if (cleaned.length() > maxLength) cleaned = cleaned.substring(0, maxLength);
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
