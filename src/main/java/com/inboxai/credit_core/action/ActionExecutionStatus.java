package com.inboxai.credit_core.action;

public enum ActionExecutionStatus {
    PENDING,
    SUCCEEDED,
    /** Charged, then the action failed. */
    FAILED,
    /** Refused for insufficient credits. Nothing charged. */
    REJECTED;

    public boolean isFinished() {
        return this != PENDING;
    }
}
