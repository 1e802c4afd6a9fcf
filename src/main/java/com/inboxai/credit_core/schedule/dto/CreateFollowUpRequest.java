package com.inboxai.credit_core.schedule.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CreateFollowUpRequest {

    @NotNull(message = "Owner ID is required")
    @JsonProperty("owner_id")
    UUID ownerId;

    @NotNull(message = "Scheduled time is required")
    @JsonProperty("scheduled_at")
    Instant scheduledAt;

    @NotBlank(message = "Recipient is required")
    @Email(message = "Recipient must be an email address")
    @JsonProperty("recipient")
    String recipient;

    @JsonProperty("follow_up_type")
    String followUpType;

    @NotBlank(message = "Template message is required")
    @Size(max = 10_000, message = "Template message is too long")
    @JsonProperty("template_message")
    String templateMessage;

    @Min(value = 0, message = "Max retries cannot be negative")
    @Max(value = 10, message = "Max retries cannot exceed 10")
    @JsonProperty("max_retries")
    Integer maxRetries;
}
