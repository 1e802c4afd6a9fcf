package com.inboxai.credit_core.schedule.event;

import com.inboxai.credit_core.schedule.ScheduleEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A schedule entry reached CANCELLED, either by its owner or because its retries ran out.
 */
@Value
public class ScheduleCancelledEvent {
    UUID eventId;
    UUID scheduleId;
    UUID userId;
    UUID orgId;
    String kind;
    int retryCount;
    boolean retriesExhausted;
    String reason;
    String lastError;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ScheduleCancelled";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ScheduleCancelledEvent of(ScheduleEntry entry, boolean retriesExhausted) {
        return new ScheduleCancelledEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getUserId(),
            entry.getOrgId(),
            entry.getKind().name(),
            entry.getRetryCount(),
            retriesExhausted,
            entry.getCancellationReason(),
            entry.getLastError(),
            entry.getCancelledAt()
        );
    }
}
