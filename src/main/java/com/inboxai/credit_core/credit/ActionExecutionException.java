package com.inboxai.credit_core.credit;

import lombok.Getter;

/**
 * A gated action failed after its credits were deducted. The credits are not refunded.
 */
@Getter
public class ActionExecutionException extends RuntimeException {

    private final ActionType actionType;
    private final int creditsUsed;
    private final int availableCredits;

    public ActionExecutionException(ActionType actionType, int creditsUsed, int availableCredits, Throwable cause) {
        super(actionType.code() + " failed after charging " + creditsUsed + " credits: " + cause.getMessage(), cause);
        this.actionType = actionType;
        this.creditsUsed = creditsUsed;
        this.availableCredits = availableCredits;
    }
}
