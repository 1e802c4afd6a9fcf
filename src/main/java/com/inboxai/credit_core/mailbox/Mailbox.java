package com.inboxai.credit_core.mailbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A connected email account polled by the fetch job.
 *
 * lastFetchedAt is the receive time of the newest message already classified. It only moves
 * forward, and only past messages that were actually processed.
 */
@Value
@Builder(toBuilder = true)
public class Mailbox {
    UUID id;
    UUID userId;
    UUID orgId;
    String emailAddress;
    boolean active;
    Instant lastFetchedAt;
    int consecutiveFailures;
    String lastError;
    Instant deactivatedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Mailbox connect(UUID userId, UUID orgId, String emailAddress, Instant now) {
        if (userId == null || orgId == null) {
            throw new IllegalArgumentException("User and organization are required");
        }
        if (emailAddress == null || emailAddress.isBlank()) {
            throw new IllegalArgumentException("Email address is required");
        }
        return Mailbox.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .orgId(orgId)
            .emailAddress(emailAddress.trim().toLowerCase(Locale.ROOT))
            .active(true)
            .consecutiveFailures(0)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * @param newestProcessed receive time of the last processed message, or null if none was
     */
    public Mailbox recordFetched(Instant newestProcessed, Instant now) {
        Instant next = lastFetchedAt;
        if (newestProcessed != null && (next == null || newestProcessed.isAfter(next))) {
            next = newestProcessed;
        }
        return toBuilder()
            .lastFetchedAt(next)
            .consecutiveFailures(0)
            .lastError(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Counts a failed fetch and deactivates the mailbox once {@code maxConsecutiveFailures} is reached.
     */
    public Mailbox recordFailure(String error, int maxConsecutiveFailures, Instant now) {
        int failures = consecutiveFailures + 1;
        MailboxBuilder next = toBuilder()
            .consecutiveFailures(failures)
            .lastError(error)
            .updatedAt(now);
        if (failures >= maxConsecutiveFailures) {
            next.active(false).deactivatedAt(now);
        }
        return next.build();
    }

    public Mailbox reactivate(Instant now) {
        return toBuilder()
            .active(true)
            .consecutiveFailures(0)
            .lastError(null)
            .deactivatedAt(null)
            .updatedAt(now)
            .build();
    }
}
