package com.inboxai.credit_core.schedule;

/**
 * Dispatch state of a schedule entry.
 *
 * PENDING -> DISPATCHED -> PENDING (digest succeeded, or a retryable failure)
 *                       -> COMPLETED (follow-up succeeded)
 *                       -> CANCELLED (retries exhausted)
 * PENDING -> CANCELLED (cancelled by the owner)
 */
public enum ScheduleStatus {
    PENDING,

    /** Claimed by one dispatcher. No other tick may pick it up. */
    DISPATCHED,

    /** Terminal. */
    COMPLETED,

    /** Terminal. */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
