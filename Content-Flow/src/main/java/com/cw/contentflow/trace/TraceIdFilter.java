package com.cw.contentflow.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 인바운드 요청마다 X-Trace-Id / X-Request-Id 를 받거나 새로 만들어 MDC 에 심고 응답 헤더로 돌려준다.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String incomingTrace = request.getHeader(TraceContext.TRACE_HEADER);
        if (incomingTrace == null || incomingTrace.isBlank()) {
            incomingTrace = request.getParameter("trace_id");
        }
        String traceId = TraceContext.normalize(incomingTrace, TraceContext.newTraceId());
        String requestId = TraceContext.normalize(request.getHeader(TraceContext.REQUEST_HEADER), TraceContext.newTraceId());

        long start = System.nanoTime();
        try (TraceContext.Scope ignored = TraceContext.open(traceId, "http")) {
            MDC.put(TraceContext.REQUEST_ID, requestId);
            response.setHeader(TraceContext.TRACE_HEADER, traceId);
            response.setHeader(TraceContext.REQUEST_HEADER, requestId);
            log.debug("request_start {} {}", request.getMethod(), request.getRequestURI());
            try {
                chain.doFilter(request, response);
            } catch (IOException | ServletException | RuntimeException e) {
                log.error("request_error {} {} ({}ms)", request.getMethod(), request.getRequestURI(), elapsedMs(start), e);
                throw e;
            }
            log.info("request_end {} {} -> {} ({}ms)",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), elapsedMs(start));
        } finally {
            MDC.remove(TraceContext.REQUEST_ID);
        }
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
