package com.inboxai.credit_core.integration;

import lombok.Value;

import java.util.UUID;

/**
 * A rendered message ready for delivery. {@code sourceId} is the schedule entry that produced it.
 */
@Value
public class OutboundMessage {
    UUID id;
    UUID userId;
    UUID orgId;
    String recipient;
    String subject;
    String body;
    String source;      // "digest" or "follow_up"
    UUID sourceId;

    public static OutboundMessage of(UUID userId, UUID orgId, String recipient, String subject,
                                     String body, String source, UUID sourceId) {
        return new OutboundMessage(UUID.randomUUID(), userId, orgId, recipient, subject, body, source, sourceId);
    }
}
