package com.inboxai.credit_core.schedule.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalTime;
import java.util.UUID;

@Value
public class CreateDigestScheduleRequest {

    @NotNull(message = "Owner ID is required")
    @JsonProperty("owner_id")
    UUID ownerId;

    @NotNull(message = "Schedule time is required")
    @JsonFormat(pattern = "HH:mm")
    @JsonProperty("schedule_time")
    LocalTime scheduleTime;

    @JsonProperty("timezone")
    String timezone;

    @NotBlank(message = "Recipient is required")
    @Email(message = "Recipient must be an email address")
    @JsonProperty("recipient")
    String recipient;

    /** Which messages the digest summarizes, e.g. "all" or "important". */
    @JsonProperty("criteria_type")
    String criteriaType;

    @Min(value = 0, message = "Max retries cannot be negative")
    @Max(value = 10, message = "Max retries cannot exceed 10")
    @JsonProperty("max_retries")
    Integer maxRetries;
}
