package com.inboxai.credit_core.credit.event;

import com.inboxai.credit_core.ledger.CreditBalance;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Monthly reset applied. Unused credits from the previous period are not carried over.
 */
@Value
public class CreditsResetEvent implements CreditEvent {
    UUID eventId;
    UUID balanceId;
    UUID userId;
    UUID orgId;
    String tier;
    int allotment;
    Instant nextResetAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditsReset";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CreditsResetEvent of(CreditBalance balance, Instant at) {
        return new CreditsResetEvent(UUID.randomUUID(), balance.getId(), balance.getUserId(),
            balance.getOrgId(), balance.getSubscriptionTier().code(), balance.getTotalCredits(),
            balance.getCreditsResetAt(), at);
    }
}
