package com.inboxai.credit_core.credit.event;

import com.inboxai.credit_core.ledger.CreditBalance;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TierChangedEvent implements CreditEvent {
    UUID eventId;
    UUID balanceId;
    UUID userId;
    UUID orgId;
    String previousTier;
    String tier;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TierChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TierChangedEvent of(CreditBalance balance, String previousTier, Instant at) {
        return new TierChangedEvent(UUID.randomUUID(), balance.getId(), balance.getUserId(),
            balance.getOrgId(), previousTier, balance.getSubscriptionTier().code(), at);
    }
}
