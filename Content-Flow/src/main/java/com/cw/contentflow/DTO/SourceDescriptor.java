package com.cw.contentflow.DTO;

import com.fasterxml.jackson.annotation.JsonIgnore;
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
 * rules.yaml 의 sources[] 한 건. 리로드 사이에는 바뀌지 않는다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceDescriptor {

    public enum Transport { NETWORK, STATIC_FILE }

    private String id;
    @Builder.Default
    private String type = "rss";
    /** 비워두면 url 스킴으로 판단 (file:, classpath: → STATIC_FILE) */
    private Transport transport;
    private String url;
    @Builder.Default
    private String fetchInterval = "30m";
    @Builder.Default
    private int weight = 1;
    @Builder.Default
    private int maxItems = 5;

    // 정제 규칙
    @Builder.Default
    private int minTitleLength = 10;
    @Builder.Default
    private List<String> blockedWords = new ArrayList<>();

    @JsonIgnore
    public Transport resolvedTransport() {
        if (transport != null) return transport;
        String u = url == null ? "" : url.trim().toLowerCase();
        return u.startsWith("file:") || u.startsWith("classpath:") ? Transport.STATIC_FILE : Transport.NETWORK;
    }
}
