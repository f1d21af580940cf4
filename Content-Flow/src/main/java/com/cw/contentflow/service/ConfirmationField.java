package com.cw.contentflow.service;

import java.util.List;
import java.util.Map;

/**
 * 확인 콜백의 논리 필드 → 테이블 컬럼 별칭 (앞에서부터 먼저 매칭되는 것 사용)
 */
public enum ConfirmationField {
    STATUS("状态", "🚦 状态", "Status", "status"),
    TITLE("原始标题", "📌 原始标题", "Title", "选题标题", "title"),
    SUMMARY("摘要", "Summary", "AI 摘要", "AI摘要", "🤖 AI 摘要", "AI Summary", "选题摘要", "summary"),
    SOURCE_URL("来源链接", "Source URL", "原文链接", "链接", "source_url"),
    SOURCE_INFO("来源", "来源信息", "Source", "source_info"),
    TRACE_ID("Trace ID", "trace_id", "追踪ID", "追踪 Id"),
    CHANNELS("发布平台", "发布渠道", "📢 发布渠道", "Channels", "平台", "channels");

    private final List<String> aliases;

    ConfirmationField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public Object lookup(Map<String, Object> fields) {
        for (String alias : aliases) {
            if (fields.containsKey(alias)) {
                return fields.get(alias);
            }
        }
        return null;
    }

    public boolean presentIn(Map<String, Object> fields) {
        for (String alias : aliases) {
            if (fields.containsKey(alias)) return true;
        }
        return false;
    }
}
