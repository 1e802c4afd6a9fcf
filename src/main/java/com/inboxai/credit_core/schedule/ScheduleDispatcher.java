package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.config.SchedulerProperties;
import com.inboxai.credit_core.integration.IntegrationException;
import com.inboxai.credit_core.observability.CorrelationContext;
import com.inboxai.credit_core.observability.SchedulerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Claims one entry, runs its task under the dispatch timeout and records the result.
 *
 * The claim (PENDING to DISPATCHED) is a conditional update against the snapshot the caller
 * selected: it fails once another dispatcher has claimed the entry or has already run it since
 * (last_run_at moved), so an entry is executed at most once per due window even with several
 * instances running. The claim is stamped with the wall-clock time it happens, which is what
 * stale recovery measures against.
 */
@Component
@Slf4j
public class ScheduleDispatcher {

    private final SchedulePersistenceService persistence;
    private final ScheduleTaskRunner taskRunner;
    private final ExecutorService executor;
    private final DueWindowPolicy dueWindowPolicy;
    private final SchedulerProperties properties;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    public ScheduleDispatcher(SchedulePersistenceService persistence,
                              ScheduleTaskRunner taskRunner,
                              @Qualifier("scheduleDispatchExecutor") ExecutorService executor,
                              DueWindowPolicy dueWindowPolicy,
                              SchedulerProperties properties,
                              SchedulerMetrics metrics,
                              Clock clock) {
        this.persistence = persistence;
        this.taskRunner = taskRunner;
        this.executor = executor;
        this.dueWindowPolicy = dueWindowPolicy;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public DispatchOutcome dispatch(ScheduleEntry entry) {
        String kind = entry.getKind().name();
        Optional<ScheduleEntry> claimed = persistence.claim(entry, clock.instant());
        if (claimed.isEmpty()) {
            log.debug("Schedule {} not claimed, skipping", entry.getId());
            metrics.recordDispatched(kind, "skipped");
            return DispatchOutcome.SKIPPED;
        }

        MDC.put(CorrelationContext.SCHEDULE_ID_MDC_KEY, entry.getId().toString());
        CorrelationContext.putTenant(entry.getUserId(), entry.getOrgId());
        try {
            try {
                runBounded(claimed.get());
            } catch (Exception e) {
                return recordFailure(claimed.get(), describe(e));
            }

            Instant finishedAt = clock.instant();
            persistence.recordSuccess(entry.getId(), finishedAt, dueWindowPolicy.nextOccurrence(entry, finishedAt));
            metrics.recordDispatched(kind, "succeeded");
            log.info("{} dispatched successfully", kind);
            return DispatchOutcome.SUCCEEDED;
        } catch (RuntimeException e) {
            // Result could not be stored; stale recovery picks the entry up later
            log.error("Failed to record dispatch result for schedule {}", entry.getId(), e);
            metrics.recordDispatched(kind, "unrecorded");
            return DispatchOutcome.FAILED;
        } finally {
            CorrelationContext.clearTenant();
        }
    }

    /**
     * Treats entries stuck in DISPATCHED (the process died mid-dispatch) as failed dispatches.
     *
     * @return how many entries were recovered
     */
    public int recoverStale(Instant now) {
        Duration staleAfter = properties.effectiveStaleAfter();
        List<ScheduleEntry> stale = persistence.findDispatchedBefore(now.minus(staleAfter), properties.getBatchSize());

        int recovered = 0;
        for (ScheduleEntry entry : stale) {
            try {
                MDC.put(CorrelationContext.SCHEDULE_ID_MDC_KEY, entry.getId().toString());
                recordFailure(entry, "Dispatch abandoned: no result after " + staleAfter);
                recovered++;
            } catch (IllegalStateException e) {
                log.debug("Schedule {} changed state during recovery: {}", entry.getId(), e.getMessage());
            } finally {
                MDC.remove(CorrelationContext.SCHEDULE_ID_MDC_KEY);
            }
        }
        if (recovered > 0) {
            metrics.recordRecovered(recovered);
            log.warn("Recovered {} stale dispatches", recovered);
        }
        return recovered;
    }

    private void runBounded(ScheduleEntry entry) throws Exception {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<?> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                taskRunner.run(entry);
            } finally {
                MDC.clear();
            }
        });

        Duration timeout = properties.getDispatchTimeout();
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IntegrationException("Dispatch timed out after " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw new IntegrationException("Dispatch failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IntegrationException("Interrupted while waiting for dispatch");
        }
    }

    private DispatchOutcome recordFailure(ScheduleEntry entry, String error) {
        String kind = entry.getKind().name();
        ScheduleEntry updated = persistence.recordFailure(entry.getId(), error, clock.instant());

        if (updated.getStatus() == ScheduleStatus.CANCELLED) {
            metrics.recordCancelled(kind);
            log.warn("{} cancelled after {} failed dispatches (max retries {}): {}",
                kind, updated.getRetryCount(), updated.getMaxRetries(), error);
            return DispatchOutcome.CANCELLED;
        }

        metrics.recordDispatched(kind, "failed");
        log.warn("{} dispatch failed (attempt {} of {}), will retry: {}",
            kind, updated.getRetryCount(), updated.getMaxRetries() + 1, error);
        return DispatchOutcome.FAILED;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
