package com.inboxai.credit_core.credit;

import java.util.Arrays;
import java.util.Locale;

/**
 * Credit-consuming actions and their built-in cost. Costs can be overridden per deployment
 * through {@link ActionCostTable}.
 */
public enum ActionType {
    EMAIL_CLASSIFICATION(1),
    EMAIL_DRAFT_SHORT(3),
    EMAIL_DRAFT_LONG(7),
    SENDER_RESEARCH_BASIC(2),
    SENDER_RESEARCH_DEEP(5),
    WORKFLOW_EXECUTION(2),
    FOLLOW_UP_SEND(1);

    private final int defaultCost;

    ActionType(int defaultCost) {
        this.defaultCost = defaultCost;
    }

    public int defaultCost() {
        return defaultCost;
    }

    /**
     * Tag written to credit_transactions.action_type, e.g. "email_classification".
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Action type is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + code));
    }
}
