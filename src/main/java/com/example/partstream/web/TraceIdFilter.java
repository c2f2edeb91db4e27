package com.example.partstream.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a request id into the MDC {@code trace} key for the duration of a request and echoes it
 * back as {@code X-Request-Id}. An incoming {@code X-Request-Id} is reused when present.
 * Part evaluation on worker threads inherits the value.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class TraceIdFilter implements Filter {

    static final String HDR_REQUEST_ID = "X-Request-Id";
    static final String MDC_TRACE = "trace";
    private static final int MAX_INCOMING_LENGTH = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        String trace = ((HttpServletRequest) request).getHeader(HDR_REQUEST_ID);
        if (trace == null || trace.isBlank() || trace.length() > MAX_INCOMING_LENGTH) {
            trace = UUID.randomUUID().toString();
        }
        MDC.put(MDC_TRACE, trace);
        ((HttpServletResponse) response).setHeader(HDR_REQUEST_ID, trace);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE);
        }
    }
}
