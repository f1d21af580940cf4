package com.cw.contentflow.trace;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 작업 단위(스캔 1회, 콜백 1회) 상관관계 ID를 MDC 로 들고 다니는 헬퍼.
 * 로그 패턴과 {@link LogCaptureAppender} 가 같은 키를 읽는다.
 */
public final class TraceContext {

    public static final String TRACE_ID = "traceId";
    public static final String PARENT_TRACE_ID = "parentTraceId";
    public static final String REQUEST_ID = "requestId";
    public static final String COMPONENT = "component";

    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String REQUEST_HEADER = "X-Request-Id";

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9_\\-]");
    private static final int MAX_ID_LENGTH = 64;

    private TraceContext() {
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * 외부에서 들어온 ID 정제. 허용 문자만 남기고 64자로 자름, 비면 fallback
     */
    public static String normalize(String raw, String fallback) {
        String cleaned = raw == null ? "" : UNSAFE.matcher(raw).replaceAll("");
        if (cleaned.length() > MAX_ID_LENGTH) {
            cleaned = cleaned.substring(0, MAX_ID_LENGTH);
        }
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    public static String normalize(String raw) {
        return normalize(raw, "");
    }

    public static String currentTraceId() {
        String id = MDC.get(TRACE_ID);
        return id == null ? "" : id;
    }

    public static String currentRequestId() {
        String id = MDC.get(REQUEST_ID);
        return id == null ? "" : id;
    }

    /**
     * 새 작업 단위 시작. 부모 trace 는 비운다.
     */
    public static Scope open(String traceId, String component) {
        Scope scope = new Scope();
        put(TRACE_ID, normalize(traceId, newTraceId()));
        MDC.remove(PARENT_TRACE_ID);
        put(COMPONENT, component);
        return scope;
    }

    /**
     * 하위 작업(아이템, 플랫폼). 현재 traceId 가 parentTraceId 로 내려간다.
     */
    public static Scope openChild(String childTraceId, String component) {
        Scope scope = new Scope();
        String parent = currentTraceId();
        put(TRACE_ID, normalize(childTraceId, newTraceId()));
        put(PARENT_TRACE_ID, parent);
        put(COMPONENT, component);
        return scope;
    }

    private static void put(String key, String value) {
        if (value == null || value.isEmpty()) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    /**
     * try-with-resources 로 닫으면 열기 전 MDC 값으로 복원
     */
    public static final class Scope implements AutoCloseable {
        private final String traceId = MDC.get(TRACE_ID);
        private final String parentTraceId = MDC.get(PARENT_TRACE_ID);
        private final String component = MDC.get(COMPONENT);

        private Scope() {
        }

        @Override
        public void close() {
            put(TRACE_ID, traceId);
            put(PARENT_TRACE_ID, parentTraceId);
            put(COMPONENT, component);
        }
    }
}
