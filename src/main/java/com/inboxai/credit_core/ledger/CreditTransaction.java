package com.inboxai.credit_core.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit record of one ledger mutation.
 * Positive creditsUsed is a spend, negative is a grant.
 */
@Value
public class CreditTransaction {
    UUID id;
    UUID userId;
    UUID orgId;
    String actionType;
    int creditsUsed;
    String description;
    Map<String, Object> metadata;
    Instant createdAt;
    Long sequenceNumber;
}
