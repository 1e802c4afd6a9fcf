package com.inboxai.credit_core.credit;

import lombok.Getter;

import java.util.UUID;

/**
 * The tenant cannot afford the action. Nothing was charged and the action was not run.
 */
@Getter
public class InsufficientCreditsException extends RuntimeException {

    private final UUID userId;
    private final UUID orgId;
    private final String actionType;
    private final int requiredCredits;
    private final int availableCredits;

    public InsufficientCreditsException(UUID userId, UUID orgId, String actionType,
                                        int requiredCredits, int availableCredits) {
        super(String.format("Insufficient credits for %s: required %d, available %d",
            actionType, requiredCredits, availableCredits));
        this.userId = userId;
        this.orgId = orgId;
        this.actionType = actionType;
        this.requiredCredits = requiredCredits;
        this.availableCredits = availableCredits;
    }
}
