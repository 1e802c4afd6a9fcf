package com.inboxai.credit_core.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by request handling and background jobs.
 *
 * HTTP requests get their correlation id and tenant from {@link CorrelationIdFilter}; scheduler ticks
 * open their own scope with {@link #openJobScope(String)}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ORG_ID_HEADER = "X-Org-Id";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String ORG_ID_MDC_KEY = "orgId";
    public static final String SCHEDULE_ID_MDC_KEY = "scheduleId";

    private CorrelationContext() {
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void putTenant(UUID userId, UUID orgId) {
        MDC.put(USER_ID_MDC_KEY, String.valueOf(userId));
        MDC.put(ORG_ID_MDC_KEY, String.valueOf(orgId));
    }

    public static void clearTenant() {
        MDC.remove(USER_ID_MDC_KEY);
        MDC.remove(ORG_ID_MDC_KEY);
        MDC.remove(SCHEDULE_ID_MDC_KEY);
    }

    /**
     * Starts a correlation scope for one background job tick. Close it in a finally block
     * or try-with-resources.
     */
    public static MDC.MDCCloseable openJobScope(String jobName) {
        return MDC.putCloseable(CORRELATION_ID_MDC_KEY, jobName + "-" + generateCorrelationId());
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        clearTenant();
    }
}
