package com.cw.contentflow.service;

import com.cw.contentflow.config.ContentFlowProperties;
import com.cw.contentflow.entity.ContentPackage;
import com.cw.contentflow.entity.RecordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalArchiveBackendTest {

    @TempDir
    Path dir;

    LocalArchiveBackend backend;

    @BeforeEach
    void setUp() {
        ContentFlowProperties properties = new ContentFlowProperties();
        properties.getArchive().setLocalDir(dir.toString());
        properties.getArchive().setPublicBaseUrl("http://archive.test/");
        Clock clock = Clock.fixed(Instant.parse("2026-10-05T02:00:00Z"), ZoneId.of("UTC"));
        backend = new LocalArchiveBackend(properties, clock);
    }

    @Test
    void topicLandsInTopicPool() throws IOException {
        ContentPackage pack = ContentPackage.builder()
                .recordType(RecordType.TOPIC)
                .traceId("abc123def456")
                .title("Open weights: model / released?")
                .summary("three sizes and a full recipe")
                .sourceUrl("https://news.example.com/posts/open-weights-model")
                .sourceInfo("twitter-openai")
                .channels(List.of("twitter", "wechat_blog"))
                .relatedContext("2026-09-01 earlier release of the small model")
                .build();

        String url = backend.write(pack);

        assertThat(url).isEqualTo("http://archive.test/local-archive/2026-10-05/topic_pool/"
                + "2026-10-05-abc123def456-Open-weights-model-released.md");
        Path file = dir.resolve("2026-10-05/topic_pool/2026-10-05-abc123def456-Open-weights-model-released.md");
        String body = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(body).startsWith("# Open weights: model / released?")
                .contains("- Suggested Platforms: twitter, wechat_blog")
                .contains("## Related")
                .contains("earlier release of the small model");
    }

    @Test
    void draftFileNameCarriesPlatform() throws IOException {
        ContentPackage pack = ContentPackage.builder()
                .recordType(RecordType.DRAFT)
                .traceId("abc123def456-zhihu")
                .platform("zhihu")
                .title("Cooling retrofit")
                .longArticle("## body")
                .imageUrls(List.of("https://img.example.com/1.png"))
                .build();

        String url = backend.write(pack);

        assertThat(url).endsWith("/draft_pool/2026-10-05-abc123def456-zhihu-zhihu-Cooling-retrofit.md");
        Path file = dir.resolve("2026-10-05/draft_pool/2026-10-05-abc123def456-zhihu-zhihu-Cooling-retrofit.md");
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .contains("- Platform: zhihu")
                .contains("- https://img.example.com/1.png");
    }

    @Test
    void unsafeCharactersAreStripped() {
        assertThat(LocalArchiveBackend.safeFilePart("  a/b:c  d ", 42, "x")).isEqualTo("abc-d");
        assertThat(LocalArchiveBackend.safeFilePart("???", 42, "untitled")).isEqualTo("untitled");
        assertThat(LocalArchiveBackend.safeFilePart(null, 42, "untraced")).isEqualTo("untraced");
        assertThat(LocalArchiveBackend.safeFilePart("abcdefgh", 4, "x")).isEqualTo("abcd");
    }
}
