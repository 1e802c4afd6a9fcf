package com.inboxai.credit_core.integration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class MessageSummary {

    @JsonProperty("message_count")
    int messageCount;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("body")
    String body;

    @JsonIgnore
    public boolean isEmpty() {
        return messageCount == 0;
    }
}
