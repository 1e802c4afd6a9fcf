package com.inboxai.credit_core.mailbox.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inboxai.credit_core.mailbox.Mailbox;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class MailboxResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("email_address")
    String emailAddress;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("last_fetched_at")
    Instant lastFetchedAt;

    @JsonProperty("consecutive_failures")
    int consecutiveFailures;

    @JsonProperty("last_error")
    String lastError;

    public static MailboxResponse from(Mailbox mailbox) {
        return MailboxResponse.builder()
            .id(mailbox.getId())
            .emailAddress(mailbox.getEmailAddress())
            .active(mailbox.isActive())
            .lastFetchedAt(mailbox.getLastFetchedAt())
            .consecutiveFailures(mailbox.getConsecutiveFailures())
            .lastError(mailbox.getLastError())
            .build();
    }
}
