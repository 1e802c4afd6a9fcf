package com.inboxai.credit_core.ledger;

/**
 * A ledger write lost a race at the storage layer (lock timeout, serialization failure,
 * duplicate insert). Transient: the credit authority retries it and callers never see it
 * unless every attempt fails.
 */
public class LedgerWriteConflictException extends RuntimeException {

    public LedgerWriteConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
