package com.inboxai.credit_core.schedule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Persistence for {@link ScheduleEntry}. No setters: state changes go through the domain
 * transitions and {@link #updateFromDomain(ScheduleEntry)}.
 */
@Entity
@Table(name = "schedule_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScheduleEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private ScheduleKind kind;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "schedule_time")
    private LocalTime scheduleTime;

    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(name = "criteria_type", length = 50)
    private String criteriaType;

    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "follow_up_type", length = 20)
    private FollowUpType followUpType;

    @Column(name = "template_message", columnDefinition = "TEXT")
    private String templateMessage;

    @Column(nullable = false, length = 320)
    private String recipient;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScheduleStatus status;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static ScheduleEntryEntity fromDomain(ScheduleEntry entry) {
        return new ScheduleEntryEntity(
            entry.getId(),
            entry.getKind(),
            entry.getUserId(),
            entry.getOrgId(),
            entry.getOwnerId(),
            entry.isActive(),
            entry.getScheduleTime(),
            entry.getTimezone(),
            entry.getCriteriaType(),
            entry.getScheduledAt(),
            entry.getFollowUpType(),
            entry.getTemplateMessage(),
            entry.getRecipient(),
            entry.getStatus(),
            entry.getLastRunAt(),
            entry.getNextRunAt(),
            entry.getDispatchedAt(),
            entry.getRetryCount(),
            entry.getMaxRetries(),
            entry.getLastError(),
            entry.getCompletedAt(),
            entry.getCancelledAt(),
            entry.getCancellationReason(),
            entry.getCreatedAt(),
            entry.getUpdatedAt()
        );
    }

    public ScheduleEntry toDomain() {
        return new ScheduleEntry(
            id,
            kind,
            userId,
            orgId,
            ownerId,
            active,
            scheduleTime,
            timezone,
            criteriaType,
            scheduledAt,
            followUpType,
            templateMessage,
            recipient,
            status,
            lastRunAt,
            nextRunAt,
            dispatchedAt,
            retryCount,
            maxRetries,
            lastError,
            completedAt,
            cancelledAt,
            cancellationReason,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable state. Identity, kind, tenant and timing definition never change.
     */
    void updateFromDomain(ScheduleEntry entry) {
        this.active = entry.isActive();
        this.status = entry.getStatus();
        this.lastRunAt = entry.getLastRunAt();
        this.nextRunAt = entry.getNextRunAt();
        this.dispatchedAt = entry.getDispatchedAt();
        this.retryCount = entry.getRetryCount();
        this.lastError = entry.getLastError();
        this.completedAt = entry.getCompletedAt();
        this.cancelledAt = entry.getCancelledAt();
        this.cancellationReason = entry.getCancellationReason();
        this.updatedAt = entry.getUpdatedAt();
    }
}
