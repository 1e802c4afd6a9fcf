package com.inboxai.credit_core.schedule.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.inboxai.credit_core.schedule.ScheduleEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScheduleEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    String kind;

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("status")
    String status;

    @JsonProperty("schedule_time")
    String scheduleTime;

    @JsonProperty("timezone")
    String timezone;

    @JsonProperty("criteria_type")
    String criteriaType;

    @JsonProperty("scheduled_at")
    Instant scheduledAt;

    @JsonProperty("follow_up_type")
    String followUpType;

    @JsonProperty("recipient")
    String recipient;

    @JsonProperty("last_run_at")
    Instant lastRunAt;

    @JsonProperty("next_run_at")
    Instant nextRunAt;

    @JsonProperty("retry_count")
    int retryCount;

    @JsonProperty("max_retries")
    int maxRetries;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ScheduleEntryResponse from(ScheduleEntry entry) {
        return ScheduleEntryResponse.builder()
            .id(entry.getId())
            .kind(entry.getKind().name())
            .ownerId(entry.getOwnerId())
            .active(entry.isActive())
            .status(entry.getStatus().name())
            .scheduleTime(entry.getScheduleTime() != null ? entry.getScheduleTime().toString() : null)
            .timezone(entry.getTimezone())
            .criteriaType(entry.getCriteriaType())
            .scheduledAt(entry.getScheduledAt())
            .followUpType(entry.getFollowUpType() != null ? entry.getFollowUpType().name() : null)
            .recipient(entry.getRecipient())
            .lastRunAt(entry.getLastRunAt())
            .nextRunAt(entry.getNextRunAt())
            .retryCount(entry.getRetryCount())
            .maxRetries(entry.getMaxRetries())
            .lastError(entry.getLastError())
            .cancellationReason(entry.getCancellationReason())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
