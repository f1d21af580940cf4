package com.cw.contentflow.service;

import com.cw.contentflow.DTO.RulesConfig;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 플랫폼별 작성 정책 (문체 / 이미지 비율 / 이미지 수)
 */
@Value
public class PlatformProfile {
    static final Set<String> LONGFORM_PLATFORMS = Set.of("wechat_blog", "zhihu", "juejin");

    String platform;
    boolean longform;
    String stylePrompt;
    String tone;
    String ratio;
    int imageCount;

    public static PlatformProfile of(String platform, RulesConfig rules) {
        boolean longform = LONGFORM_PLATFORMS.contains(platform);
        String style = longform ? "longform_deep_analysis" : "casual_log_style";

        // rules 에 플랫폼 정책이 있고 기본값이 아니면 그 문체를 우선
        RulesConfig.PlatformPolicy policy = rules == null ? null : rules.getPlatforms().get(platform);
        if (policy != null && policy.getStylePrompt() != null
                && !policy.getStylePrompt().isBlank() && !"default".equals(policy.getStylePrompt())) {
            style = policy.getStylePrompt();
        }

        return longform
                ? new PlatformProfile(platform, true, style, "技术解读、影响分析、科普解释，结构化长文", "3:4", 3)
                : new PlatformProfile(platform, false, style, "记录、日志、感慨、口语化交流", "16:9", 1);
    }

    /**
     * 생성 워커로 넘기는 platform_strategy
     */
    public Map<String, Object> toStrategy() {
        Map<String, Object> strategy = new LinkedHashMap<>();
        strategy.put("enabled", true);
        strategy.put("style_prompt", stylePrompt);
        strategy.put("tone", tone);
        strategy.put("content_format", longform ? "longform" : "shortform");
        return Map.of(platform, strategy);
    }
}
