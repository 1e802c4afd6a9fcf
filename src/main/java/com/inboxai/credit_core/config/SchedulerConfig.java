package com.inboxai.credit_core.config;

import com.inboxai.credit_core.schedule.DueWindowPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SchedulerConfig {

    /**
     * All "now" readings go through this clock. Jobs are evaluated in UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs individual schedule dispatches so a hung collaborator can be abandoned at the timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scheduleDispatchExecutor(SchedulerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "schedule-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getDispatchThreads(), threadFactory);
    }

    @Bean
    public DueWindowPolicy dueWindowPolicy(SchedulerProperties properties) {
        return new DueWindowPolicy(properties.getDigest().getDueWindow(), properties.getDigest().getCooldown());
    }
}
