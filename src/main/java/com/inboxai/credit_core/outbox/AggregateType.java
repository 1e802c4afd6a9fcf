package com.inboxai.credit_core.outbox;

import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregates that publish through the outbox. Each one maps to its own Kafka topic.
 */
public enum AggregateType {
    CREDIT_BALANCE("CreditBalance"),
    SCHEDULE_ENTRY("ScheduleEntry"),
    OUTBOUND_MESSAGE("OutboundMessage");

    private final String label;

    AggregateType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<AggregateType> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(type -> type.label.equals(label))
            .findFirst();
    }
}
