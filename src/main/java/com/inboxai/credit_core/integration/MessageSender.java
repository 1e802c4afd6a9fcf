package com.inboxai.credit_core.integration;

/**
 * Send-message capability.
 */
public interface MessageSender {

    void send(OutboundMessage message);
}
