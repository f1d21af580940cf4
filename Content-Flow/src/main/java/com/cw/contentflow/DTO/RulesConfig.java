package com.cw.contentflow.DTO;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * rules.yaml 전체 문서
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RulesConfig {

    @JsonProperty("global")
    private GlobalConfig globalConfig = new GlobalConfig();
    private List<SourceDescriptor> sources = new ArrayList<>();
    private Map<String, PlatformPolicy> platforms = new LinkedHashMap<>();
    private FilterRules filter = new FilterRules();
    private VisualConfig visual = new VisualConfig();

    /**
     * 활성 플랫폼 이름 (rules 순서 유지)
     */
    public List<String> enabledPlatforms() {
        List<String> names = new ArrayList<>();
        platforms.forEach((name, policy) -> {
            if (policy != null && policy.isEnabled()) names.add(name);
        });
        return names;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class GlobalConfig {
        private String timezone = "Asia/Shanghai";
        private int memoryRetentionDays = 30;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PlatformPolicy {
        private boolean enabled = true;
        private String stylePrompt = "default";
        /** HH:MM, 있으면 매일 그 시각에 전체 소스 실행 */
        private String schedule;
        private Integer maxPostsPerDay;
        private Integer minWordCount;
    }

    /**
     * 고가치 신호 필터 (생성 모델 호출 없음)
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FilterRules {
        private int minTextLength = 220;
        private int minScore = 2;
        private List<String> highValueHints = new ArrayList<>(List.of(
                "发布", "开源", "上线", "agent", "benchmark", "paper", "模型", "融资", "sota"));
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VisualConfig {
        private String defaultStyle = "cyberpunk, data flow";
        private String defaultRatio = "16:9";
    }
}
