package com.cw.contentflow.trace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 프로세스 전역 로그 집계소. 모든 컴포넌트의 로그가 한 곳에 쌓이고
 * traceId / component / level 로 조회된다. 용량을 넘으면 오래된 것부터 버린다.
 */
public class LogStore {

    private final int capacity;
    private final Deque<LogEntry> entries = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();

    public LogStore(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public long nextSeq() {
        return sequence.incrementAndGet();
    }

    public synchronized void add(LogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.pollFirst();
        }
    }

    /**
     * 최신순. traceId 는 trace 자신 또는 부모 trace 가 일치하면 매칭
     */
    public synchronized List<LogEntry> query(LogQuery query) {
        int limit = query.safeLimit();
        String traceId = TraceContext.normalize(query.getTraceId());
        String component = trimToEmpty(query.getComponent());
        String level = trimToEmpty(query.getLevel()).toUpperCase(Locale.ROOT);
        String keyword = trimToEmpty(query.getKeyword()).toLowerCase(Locale.ROOT);

        List<LogEntry> result = new ArrayList<>();
        Iterator<LogEntry> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            LogEntry e = it.next();
            if (!traceId.isEmpty() && !traceId.equals(e.getTraceId()) && !traceId.equals(e.getParentTraceId())) continue;
            if (!component.isEmpty() && !component.equalsIgnoreCase(e.getComponent())) continue;
            if (!level.isEmpty() && !level.equals(e.getLevel())) continue;
            if (!keyword.isEmpty() && (e.getMessage() == null
                    || !e.getMessage().toLowerCase(Locale.ROOT).contains(keyword))) continue;
            result.add(e);
        }
        return result;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private static String trimToEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
