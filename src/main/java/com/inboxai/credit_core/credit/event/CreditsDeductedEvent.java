package com.inboxai.credit_core.credit.event;

import com.inboxai.credit_core.ledger.CreditBalance;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CreditsDeductedEvent implements CreditEvent {
    UUID eventId;
    UUID balanceId;
    UUID userId;
    UUID orgId;
    String actionType;
    int credits;
    int availableCredits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditsDeducted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CreditsDeductedEvent of(CreditBalance balance, String actionType, int credits, Instant at) {
        return new CreditsDeductedEvent(UUID.randomUUID(), balance.getId(), balance.getUserId(),
            balance.getOrgId(), actionType, credits, balance.getAvailableCredits(), at);
    }
}
