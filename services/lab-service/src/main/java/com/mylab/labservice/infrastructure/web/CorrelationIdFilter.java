package com.mylab.labservice.infrastructure.web;

import com.mylab.observability.CorrelationContext;
import com.mylab.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens the correlation scope of a request. An upstream {@code X-Correlation-ID} is kept when it
 * is a plain token; anything else is replaced so log lines cannot be forged through the header.
 * Both the correlation ID and this request's own ID are echoed on the response.
 *
 * <p>The caller's workspace and user are attached later by {@link CallerContextArgumentResolver}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = UUID.randomUUID().toString();
        String correlationId = acceptedCorrelationId(request.getHeader(CORRELATION_ID_HEADER));

        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try (CorrelationContextHolder.Scope ignored = CorrelationContextHolder.open(
                new CorrelationContext(correlationId, null, null, requestId))) {
            filterChain.doFilter(request, response);
        }
    }

    static String acceptedCorrelationId(String header) {
        if (header == null || header.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String candidate = header.strip();
        if (!ACCEPTED_ID.matcher(candidate).matches()) {
            log.warn("Replacing malformed {} header ({} chars)", CORRELATION_ID_HEADER, candidate.length());
            return UUID.randomUUID().toString();
        }
        return candidate;
    }
}
