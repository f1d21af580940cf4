package com.cw.contentflow.service;

import com.cw.contentflow.DTO.NormalizedItem;
import com.cw.contentflow.DTO.RulesConfig;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 고가치 신호 판별 (모델 호출 없음)
 * 본문 길이 / 이미지 유무 / 키워드 힌트 각 1점, minScore 이상만 통과
 */
@Component
public class SignalFilter {

    public int score(NormalizedItem item, RulesConfig.FilterRules rules) {
        int score = 0;
        String rawText = nullToEmpty(item.getRawText());
        if (rawText.length() >= rules.getMinTextLength()) score++;
        if (item.getImages() != null && !item.getImages().isEmpty()) score++;

        String text = String.join("\n", nullToEmpty(item.getTitle()), rawText, nullToEmpty(item.getSummary()))
                .toLowerCase(Locale.ROOT);
        for (String hint : rules.getHighValueHints()) {
            if (hint != null && !hint.isBlank() && text.contains(hint.toLowerCase(Locale.ROOT))) {
                score++;
                break;
            }
        }
        return score;
    }

    public boolean isHighValue(NormalizedItem item, RulesConfig.FilterRules rules) {
        return score(item, rules) >= rules.getMinScore();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
