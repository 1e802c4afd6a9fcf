package com.inboxai.credit_core.integration;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * A message as returned by the mailbox gateway. Bodies stay in the gateway; only what the
 * classifier needs travels here.
 */
@Value
public class MailboxMessage {

    @JsonProperty("message_id")
    String messageId;

    @JsonProperty("thread_id")
    String threadId;

    @JsonProperty("sender")
    String sender;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("snippet")
    String snippet;

    @JsonProperty("received_at")
    Instant receivedAt;
}
