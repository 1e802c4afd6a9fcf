package com.inboxai.credit_core.ledger;

/**
 * Kind of mutation applied to a credit balance.
 * The sign of {@code credits_used} on the resulting transaction follows from it:
 * spends are positive, grants negative, resets carry the net change.
 */
public enum EntryType {
    SPEND,
    GRANT,
    RESET
}
