package com.cw.contentflow.trace;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class LogEntry {
    long seq;
    Instant timestamp;
    String level;
    String logger;
    String component;
    String message;
    String traceId;
    String parentTraceId;
    String requestId;
    String thread;
    String exception;
}
