package com.inboxai.credit_core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "credits")
@Getter @Setter
public class CreditProperties {

    /**
     * Cost overrides keyed by action code, e.g. {@code credits.costs.email_draft_long=8}.
     * Actions not listed keep their built-in cost.
     */
    private Map<String, Integer> costs = new HashMap<>();

    private Ledger ledger = new Ledger();
    private Reset reset = new Reset();

    @Getter @Setter
    public static class Ledger {
        /** Attempts per ledger write, including the first. */
        private int maxAttempts = 3;
        private long backoffMs = 50;
    }

    @Getter @Setter
    public static class Reset {
        private int batchSize = 200;
    }
}
