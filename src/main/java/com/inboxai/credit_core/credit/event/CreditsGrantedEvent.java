package com.inboxai.credit_core.credit.event;

import com.inboxai.credit_core.ledger.CreditBalance;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CreditsGrantedEvent implements CreditEvent {
    UUID eventId;
    UUID balanceId;
    UUID userId;
    UUID orgId;
    int credits;
    int availableCredits;
    String description;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditsGranted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CreditsGrantedEvent of(CreditBalance balance, int credits, String description, Instant at) {
        return new CreditsGrantedEvent(UUID.randomUUID(), balance.getId(), balance.getUserId(),
            balance.getOrgId(), credits, balance.getAvailableCredits(), description, at);
    }
}
