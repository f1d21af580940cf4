package com.cw.contentflow.trace;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * 루트 로거에 붙어 모든 로그 이벤트를 {@link LogStore} 로 복사하는 Logback 어펜더.
 */
public class LogCaptureAppender extends AppenderBase<ILoggingEvent> {

    static final String APPENDER_NAME = "CONTENT_FLOW_LOG_STORE";

    private final LogStore store;

    public LogCaptureAppender(LogStore store) {
        this.store = store;
        setName(APPENDER_NAME);
    }

    public void attach() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        setContext(ctx);
        start();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(this);
    }

    public void detach() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(this);
        stop();
    }

    @Override
    protected void append(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap();
        IThrowableProxy thrown = event.getThrowableProxy();
        store.add(LogEntry.builder()
                .seq(store.nextSeq())
                .timestamp(Instant.ofEpochMilli(event.getTimeStamp()))
                .level(event.getLevel().toString())
                .logger(event.getLoggerName())
                .component(componentOf(mdc, event.getLoggerName()))
                .message(event.getFormattedMessage())
                .traceId(mdc.getOrDefault(TraceContext.TRACE_ID, ""))
                .parentTraceId(mdc.getOrDefault(TraceContext.PARENT_TRACE_ID, ""))
                .requestId(mdc.getOrDefault(TraceContext.REQUEST_ID, ""))
                .thread(event.getThreadName())
                .exception(thrown == null ? null : ThrowableProxyUtil.asString(thrown))
                .build());
    }

    private static String componentOf(Map<String, String> mdc, String loggerName) {
        String component = mdc.get(TraceContext.COMPONENT);
        if (component != null && !component.isEmpty()) return component;
        int dot = loggerName.lastIndexOf('.');
        return dot >= 0 ? loggerName.substring(dot + 1) : loggerName;
    }
}
