package com.inboxai.credit_core.integration;

/**
 * An external collaborator (mailbox gateway, AI worker, message delivery) failed or returned
 * something unusable.
 */
public class IntegrationException extends RuntimeException {

    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
