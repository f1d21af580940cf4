package com.cw.contentflow.DTO;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 피드 워커가 돌려주는 정규화된 아이템. 한 번 쓰고 버림.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NormalizedItem {
    private String sourceId;
    @JsonAlias({"url_hash", "urlHash"})
    private String fingerprint; // SHA-256(link)
    private String title;
    private String url;
    @Builder.Default
    private String summary = "";
    @Builder.Default
    private String rawText = "";
    private String publishedAt;
    @Builder.Default
    private List<String> images = new ArrayList<>();
    @Builder.Default
    private List<String> keywords = new ArrayList<>();
}
