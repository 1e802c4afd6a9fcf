package com.inboxai.credit_core.credit.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger facts published through the outbox. The aggregate is the balance row.
 */
public interface CreditEvent {

    UUID getEventId();

    UUID getBalanceId();

    UUID getUserId();

    UUID getOrgId();

    Instant getOccurredAt();

    String getEventType();
}
