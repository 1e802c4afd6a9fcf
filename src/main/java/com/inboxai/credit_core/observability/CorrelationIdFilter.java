package com.inboxai.credit_core.observability;

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
import java.util.UUID;

/**
 * Puts the request's correlation id and tenant into the MDC for the length of the request.
 *
 * The correlation id comes from X-Correlation-ID, or is generated, and is echoed on the response.
 * The tenant comes from the X-User-Id and X-Org-Id headers; a missing or malformed pair is left out
 * of the MDC and rejected later by the controller's header binding.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = CorrelationContext.generateCorrelationId();
        }

        try {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            UUID userId = parseTenantHeader(request, CorrelationContext.USER_ID_HEADER);
            UUID orgId = parseTenantHeader(request, CorrelationContext.ORG_ID_HEADER);
            if (userId != null && orgId != null) {
                CorrelationContext.putTenant(userId, orgId);
            }
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    private static UUID parseTenantHeader(HttpServletRequest request, String header) {
        String value = request.getHeader(header);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed {} header for logging context", header);
            return null;
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
