package com.warden.authservice.infrastructure.web;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
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
 * Binds a {@link CorrelationContext} to every HTTP request.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is reused when it looks sane (at most 64 chars of
 * letters, digits, dash, underscore or dot); otherwise a new UUID is generated. The id is echoed in
 * the response header and the context is cleared when the request completes, since Tomcat reuses
 * threads.
 *
 * <p>Runs first so the id is available to every later filter, the argument resolvers and the
 * audit trail.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || !ACCEPTED_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(CorrelationContext.start(correlationId, request.getRemoteAddr()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }
}
