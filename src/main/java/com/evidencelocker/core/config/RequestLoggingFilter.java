package com.evidencelocker.core.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a correlation id (echoed back in {@code X-Request-Id} and put in the
 * MDC) and logs method, path, status and duration. Never logs bearer tokens.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,64}$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(HEADER_NAME);
        if (requestId == null || !SAFE_REQUEST_ID.matcher(requestId).matches()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER_NAME, requestId);

        String method = request.getMethod();
        String uri = request.getRequestURI();
        log.debug("Request {} started: {} {} (bearer token {})", requestId, method, uri,
                request.getHeader("Authorization") != null ? "present" : "absent");

        long startTime = System.currentTimeMillis();
        try {
            chain.doFilter(request, response);
            log.info("{} {} -> {} in {}ms", method, uri, response.getStatus(), System.currentTimeMillis() - startTime);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("{} {} failed after {}ms: {}", method, uri, System.currentTimeMillis() - startTime, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
