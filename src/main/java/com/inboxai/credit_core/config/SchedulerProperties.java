package com.inboxai.credit_core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Getter @Setter
public class SchedulerProperties {

    /** Upper bound on one dispatch, collaborator calls included. */
    private Duration dispatchTimeout = Duration.ofMinutes(10);

    /** Retries granted to new entries when the caller does not choose. */
    private int defaultMaxRetries = 3;

    private int batchSize = 100;
    private int dispatchThreads = 4;

    private Digest digest = new Digest();

    /** DISPATCHED entries older than this are treated as a failed dispatch. Defaults to twice the dispatch timeout. */
    private Duration staleAfter;

    @Getter @Setter
    public static class Digest {
        private Duration dueWindow = Duration.ofMinutes(5);
        private Duration cooldown = Duration.ofHours(23);
    }

    public Duration effectiveStaleAfter() {
        return staleAfter != null ? staleAfter : dispatchTimeout.multipliedBy(2);
    }
}
