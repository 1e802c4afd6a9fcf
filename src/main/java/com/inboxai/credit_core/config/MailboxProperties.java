package com.inboxai.credit_core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "mailbox.fetch")
@Getter @Setter
public class MailboxProperties {
    private int batchSize = 100;
    private int maxMessagesPerMailbox = 50;
    /** A mailbox is deactivated after this many fetch failures in a row. */
    private int maxConsecutiveFailures = 5;
}
