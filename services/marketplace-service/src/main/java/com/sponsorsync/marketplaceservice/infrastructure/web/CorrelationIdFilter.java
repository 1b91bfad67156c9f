package com.sponsorsync.marketplaceservice.infrastructure.web;

import com.sponsorsync.observability.CorrelationContext;
import com.sponsorsync.observability.CorrelationContextHolder;
import com.sponsorsync.security.PrincipalHeaderExtractor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation id for every HTTP request and records the calling
 * principal, so every log line of the request carries both.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is kept, otherwise a random UUID is used. The id is
 * echoed on the response. The principal id is only put in the logging context when the
 * {@code X-Principal-Id} header holds a valid UUID.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String principalId = PrincipalHeaderExtractor
                .extract(request.getHeader(PrincipalHeaderExtractor.PRINCIPAL_HEADER))
                .principalId()
                .map(UUID::toString)
                .orElse(null);

        CorrelationContextHolder.set(
                new CorrelationContext(correlationId, principalId, UUID.randomUUID().toString()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
