package com.inboxai.credit_core.schedule;

import lombok.Builder;
import lombok.Value;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.UUID;

/**
 * A digest schedule or a follow-up, with an explicit dispatch state machine.
 *
 * Key principles:
 * - transitions are methods that validate the current status and return a new instance
 * - lastRunAt moves only on a successful dispatch, which is what the cooldown measures from
 * - an inactive or terminal entry is never selected for dispatch
 */
@Value
@Builder(toBuilder = true)
public class ScheduleEntry {
    UUID id;
    ScheduleKind kind;
    UUID userId;
    UUID orgId;
    UUID ownerId;              // the agent or mailbox the entry belongs to
    boolean active;

    // DIGEST
    LocalTime scheduleTime;
    String timezone;
    String criteriaType;

    // FOLLOW_UP
    Instant scheduledAt;
    FollowUpType followUpType;
    String templateMessage;

    String recipient;
    ScheduleStatus status;
    Instant lastRunAt;
    Instant nextRunAt;
    Instant dispatchedAt;
    int retryCount;
    int maxRetries;
    String lastError;
    Instant completedAt;
    Instant cancelledAt;
    String cancellationReason;
    Instant createdAt;
    Instant updatedAt;

    public static ScheduleEntry digest(UUID userId, UUID orgId, UUID ownerId, LocalTime scheduleTime,
                                       String timezone, String recipient, String criteriaType,
                                       int maxRetries, Instant now) {
        if (scheduleTime == null) {
            throw new IllegalArgumentException("Schedule time is required");
        }
        String zone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        parseZone(zone);
        return base(ScheduleKind.DIGEST, userId, orgId, ownerId, recipient, maxRetries, now)
            .scheduleTime(scheduleTime.withSecond(0).withNano(0))
            .timezone(zone)
            .criteriaType(criteriaType == null || criteriaType.isBlank() ? "all" : criteriaType.trim())
            .build();
    }

    public static ScheduleEntry followUp(UUID userId, UUID orgId, UUID ownerId, Instant scheduledAt,
                                         String recipient, FollowUpType followUpType,
                                         String templateMessage, int maxRetries, Instant now) {
        if (scheduledAt == null) {
            throw new IllegalArgumentException("Scheduled time is required");
        }
        return base(ScheduleKind.FOLLOW_UP, userId, orgId, ownerId, recipient, maxRetries, now)
            .timezone("UTC")
            .scheduledAt(scheduledAt)
            .nextRunAt(scheduledAt)
            .followUpType(followUpType == null ? FollowUpType.CUSTOM : followUpType)
            .templateMessage(templateMessage)
            .build();
    }

    private static ScheduleEntryBuilder base(ScheduleKind kind, UUID userId, UUID orgId, UUID ownerId,
                                             String recipient, int maxRetries, Instant now) {
        if (userId == null || orgId == null || ownerId == null) {
            throw new IllegalArgumentException("User, organization and owner are required");
        }
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("Recipient is required");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        return ScheduleEntry.builder()
            .id(UUID.randomUUID())
            .kind(kind)
            .userId(userId)
            .orgId(orgId)
            .ownerId(ownerId)
            .active(true)
            .recipient(recipient.trim())
            .status(ScheduleStatus.PENDING)
            .retryCount(0)
            .maxRetries(maxRetries)
            .createdAt(now)
            .updatedAt(now);
    }

    public ZoneId zoneId() {
        return parseZone(timezone);
    }

    /**
     * Eligible for the due check. Says nothing about timing.
     */
    public boolean isSelectable() {
        return active && status == ScheduleStatus.PENDING;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public ScheduleEntry markDispatched(Instant now) {
        if (!isSelectable()) {
            throw new IllegalStateException(String.format(
                "Cannot dispatch schedule %s: status=%s, active=%s", id, status, active));
        }
        return toBuilder()
            .status(ScheduleStatus.DISPATCHED)
            .dispatchedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * A digest goes back to PENDING for its next occurrence; a follow-up completes.
     *
     * @param nextRunAt next digest occurrence, ignored for follow-ups
     */
    public ScheduleEntry recordSuccess(Instant now, Instant nextRunAt) {
        requireDispatched("record success for");
        ScheduleEntryBuilder next = toBuilder()
            .lastRunAt(now)
            .dispatchedAt(null)
            .retryCount(0)
            .lastError(null)
            .updatedAt(now);

        if (kind == ScheduleKind.FOLLOW_UP) {
            return next.status(ScheduleStatus.COMPLETED).completedAt(now).nextRunAt(null).build();
        }
        return next.status(ScheduleStatus.PENDING).nextRunAt(nextRunAt).build();
    }

    /**
     * Counts a failed dispatch. Once the count exceeds maxRetries the entry is cancelled
     * for good.
     */
    public ScheduleEntry recordFailure(String error, Instant now) {
        requireDispatched("record failure for");
        int retries = retryCount + 1;
        ScheduleEntryBuilder next = toBuilder()
            .retryCount(retries)
            .lastError(error)
            .dispatchedAt(null)
            .updatedAt(now);

        if (retries > maxRetries) {
            return next.status(ScheduleStatus.CANCELLED)
                .cancelledAt(now)
                .cancellationReason("Retries exhausted after " + retries + " failed dispatches: " + error)
                .nextRunAt(null)
                .build();
        }
        return next.status(ScheduleStatus.PENDING).build();
    }

    public ScheduleEntry cancel(String reason, Instant now) {
        if (isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot cancel schedule %s in %s status", id, status));
        }
        return toBuilder()
            .status(ScheduleStatus.CANCELLED)
            .cancelledAt(now)
            .cancellationReason(reason == null || reason.isBlank() ? "Cancelled by owner" : reason)
            .nextRunAt(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Stops future ticks from selecting the entry. A dispatch already in flight still finishes.
     */
    public ScheduleEntry deactivate(Instant now) {
        if (isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot deactivate schedule %s in %s status", id, status));
        }
        return toBuilder().active(false).updatedAt(now).build();
    }

    public ScheduleEntry activate(Instant now, Instant nextRunAt) {
        if (isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot activate schedule %s in %s status", id, status));
        }
        return toBuilder()
            .active(true)
            .nextRunAt(kind == ScheduleKind.DIGEST ? nextRunAt : scheduledAt)
            .updatedAt(now)
            .build();
    }

    private void requireDispatched(String action) {
        if (status != ScheduleStatus.DISPATCHED) {
            throw new IllegalStateException(String.format(
                "Cannot %s schedule %s in %s status. Only DISPATCHED entries can.", action, id, status));
        }
    }

    private static ZoneId parseZone(String timezone) {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone);
        }
    }
}
