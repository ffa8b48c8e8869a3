package com.registry.api.web;

import com.registry.engine.logging.LoggingContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Gives every request a trace ID, taken from {@code X-Trace-Id} when the
 * caller sends one, and echoes it back. The MDC is cleared when the request ends.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String HEADER_TRACE_ID = "X-Trace-Id";

    private static final int MAX_TRACE_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(HEADER_TRACE_ID));
        LoggingContext.setTraceId(traceId);
        response.setHeader(HEADER_TRACE_ID, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            LoggingContext.clearAll();
        }
    }

    static String resolveTraceId(String header) {
        if (header == null || header.isBlank()
                || header.length() > MAX_TRACE_ID_LENGTH
                || !header.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-')) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
        return header;
    }
}
