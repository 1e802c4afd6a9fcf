package com.inboxai.credit_core.schedule;

public enum DispatchOutcome {
    SUCCEEDED,
    /** Failed and will be retried on a later tick. */
    FAILED,
    /** Failed for the last time; the entry is now CANCELLED. */
    CANCELLED,
    /** Not claimed: another dispatcher got it, or it stopped being selectable. */
    SKIPPED
}
