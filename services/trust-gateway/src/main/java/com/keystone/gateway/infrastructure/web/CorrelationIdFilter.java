package com.keystone.gateway.infrastructure.web;

import com.keystone.observability.CorrelationContext;
import com.keystone.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates the correlation id for every HTTP request and echoes it back.
 *
 * <p>An incoming id is kept only if it is 1 to 128 characters of {@code [A-Za-z0-9._:-]};
 * anything else is replaced, so log lines and the echoed header never carry caller-controlled
 * markup. The trace and span ids of an active server span, if any, are bound with it. The id
 * lands in MDC through {@link CorrelationContextHolder}; the authentication
 * interceptor adds the customer id later in the request. Runs first so every other filter
 * logs with it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = acceptedOrNew(request.getHeader(CORRELATION_ID_HEADER));

        CorrelationContextHolder.set(
                CorrelationContext.ofCurrentSpan(correlationId, UUID.randomUUID().toString()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }

    /** The caller's id if it is safe to echo and log, otherwise a fresh UUID. */
    static String acceptedOrNew(String header) {
        if (header != null) {
            String candidate = header.strip();
            if (ACCEPTED_ID.matcher(candidate).matches()) {
                return candidate;
            }
        }
        return UUID.randomUUID().toString();
    }
}
