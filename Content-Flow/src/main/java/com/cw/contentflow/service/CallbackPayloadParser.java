package com.cw.contentflow.service;

import com.cw.contentflow.DTO.ConfirmationEvent;
import com.cw.contentflow.trace.TraceContext;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 외부 테이블 확인 콜백 파싱.
 * 필드 위치(event / event.record / event.data ...)와 컬럼 이름이 제각각이라 별칭·경로 후보를 순서대로 시도한다.
 */
@Component
public class CallbackPayloadParser {

    static final Set<String> TRIGGER_STATUSES = Set.of(
            "confirm", "confirmed", "approved", "ready", "ready_to_generate", "确认", "已确认", "通过");

    private static final Map<String, String> PLATFORM_ALIASES = Map.ofEntries(
            Map.entry("twitter", "twitter"),
            Map.entry("x", "twitter"),
            Map.entry("推特", "twitter"),
            Map.entry("zhihu", "zhihu"),
            Map.entry("知乎", "zhihu"),
            Map.entry("juejin", "juejin"),
            Map.entry("掘金", "juejin"),
            Map.entry("wechat", "wechat_blog"),
            Map.entry("wechat_blog", "wechat_blog"),
            Map.entry("公众号", "wechat_blog"),
            Map.entry("weixin", "wechat_blog"),
            Map.entry("xiaohongshu", "xiaohongshu"),
            Map.entry("xhs", "xiaohongshu"),
            Map.entry("小红书", "xiaohongshu"));

    private static final Pattern CHANNEL_SEPARATOR = Pattern.compile("[,，/\\\\|]");
    private static final Pattern TITLE_TRACE_MARKER = Pattern.compile("\\[#([A-Za-z0-9_\\-]+)]");
    private static final List<String> OBJECT_TEXT_KEYS = List.of("text", "name", "value", "link", "url");

    public boolean isHandshake(Map<String, Object> payload) {
        return "url_verification".equals(payload.get("type"));
    }

    public String challenge(Map<String, Object> payload) {
        return toText(payload.get("challenge"));
    }

    /**
     * fields 맵 위치 탐색. payload → event → event.record → event.data → event.data.record → event.after → event.after.record.
     * 어디에도 fields 가 없으면, 최상위에 알려진 컬럼이 있을 때 payload 자체를 fields 로 본다.
     */
    public Optional<Map<String, Object>> locateFields(Map<String, Object> payload) {
        Map<String, Object> event = asMap(payload.get("event"));
        if (event == null) event = payload;

        Map<String, Object> data = asMap(event.get("data"));
        Map<String, Object> after = asMap(event.get("after"));
        List<Map<String, Object>> candidates = new ArrayList<>();
        candidates.add(payload);
        candidates.add(event);
        candidates.add(asMap(event.get("record")));
        candidates.add(data);
        candidates.add(data == null ? null : asMap(data.get("record")));
        candidates.add(after);
        candidates.add(after == null ? null : asMap(after.get("record")));

        for (Map<String, Object> candidate : candidates) {
            if (candidate == null) continue;
            Map<String, Object> fields = asMap(candidate.get("fields"));
            if (fields != null && !fields.isEmpty()) return Optional.of(fields);
        }
        if (ConfirmationField.STATUS.presentIn(payload) || ConfirmationField.TITLE.presentIn(payload)) {
            return Optional.of(payload);
        }
        return Optional.empty();
    }

    public ConfirmationEvent parse(Map<String, Object> fields) {
        String title = toText(ConfirmationField.TITLE.lookup(fields));
        String traceId = TraceContext.normalize(toText(ConfirmationField.TRACE_ID.lookup(fields)));
        if (traceId.isEmpty()) {
            Matcher m = TITLE_TRACE_MARKER.matcher(title);
            if (m.find()) traceId = TraceContext.normalize(m.group(1));
        }
        if (traceId.isEmpty()) {
            traceId = TraceContext.newTraceId();
        }

        return ConfirmationEvent.builder()
                .status(toText(ConfirmationField.STATUS.lookup(fields)))
                .title(title)
                .summary(toText(ConfirmationField.SUMMARY.lookup(fields)))
                .sourceUrl(toText(ConfirmationField.SOURCE_URL.lookup(fields)))
                .sourceInfo(toText(ConfirmationField.SOURCE_INFO.lookup(fields)))
                .topicTraceId(traceId)
                .channels(normalizeChannels(ConfirmationField.CHANNELS.lookup(fields)))
                .build();
    }

    public static boolean isTrigger(String status) {
        return status != null && TRIGGER_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 문자열은 trim, 리스트는 ", " 로 연결, 객체는 text/name/value/link/url 순
     */
    static String toText(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s.trim();
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        if (value instanceof Collection<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object v : list) {
                String text = toText(v);
                if (!text.isEmpty()) parts.add(text);
            }
            return String.join(", ", parts);
        }
        Map<String, Object> map = asMap(value);
        if (map != null) {
            for (String key : OBJECT_TEXT_KEYS) {
                if (map.containsKey(key)) {
                    String text = toText(map.get(key));
                    if (!text.isEmpty()) return text;
                }
            }
        }
        return "";
    }

    /**
     * 리스트 / "a,b" "a/b" "a|b" 문자열 / 옵션 객체 → 정규화된 플랫폼 목록 (순서 유지, 중복 제거)
     */
    static List<String> normalizeChannels(Object value) {
        List<Object> rawItems = new ArrayList<>();
        if (value instanceof Collection<?> list) {
            rawItems.addAll(list);
        } else if (value instanceof String s) {
            for (String part : CHANNEL_SEPARATOR.split(s)) {
                if (!part.isBlank()) rawItems.add(part.trim());
            }
        } else if (asMap(value) != null) {
            Map<String, Object> map = asMap(value);
            String single = toText(map);
            if (!single.isEmpty()) rawItems.add(single);
        }

        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (Object item : rawItems) {
            String platform = normalizePlatform(toText(item));
            if (!platform.isEmpty()) normalized.add(platform);
        }
        return new ArrayList<>(normalized);
    }

    static String normalizePlatform(String value) {
        String raw = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return PLATFORM_ALIASES.getOrDefault(raw, raw);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }
}
