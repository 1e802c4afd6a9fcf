package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.config.SchedulerProperties;
import com.inboxai.credit_core.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic ticks for digests, follow-ups and stale dispatch recovery.
 *
 * A tick never throws: one entry failing is recorded on that entry and the loop moves on.
 */
@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ScheduleDispatchJob {

    private final SchedulePersistenceService persistence;
    private final ScheduleDispatcher dispatcher;
    private final DueWindowPolicy dueWindowPolicy;
    private final SchedulerProperties properties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${scheduler.digest.poll-interval-ms:300000}",
               initialDelayString = "${scheduler.digest.initial-delay-ms:30000}")
    public void dispatchDueDigests() {
        try (MDC.MDCCloseable ignored = CorrelationContext.openJobScope("digest")) {
            logSummary("Digest", runDigestTick(clock.instant()));
        } catch (Exception e) {
            log.error("Digest tick failed, will retry next tick", e);
        }
    }

    @Scheduled(cron = "${scheduler.follow-ups.cron:0 0 * * * *}", zone = "UTC")
    public void dispatchDueFollowUps() {
        try (MDC.MDCCloseable ignored = CorrelationContext.openJobScope("follow-up")) {
            logSummary("Follow-up", runFollowUpTick(clock.instant()));
        } catch (Exception e) {
            log.error("Follow-up tick failed, will retry next tick", e);
        }
    }

    @Scheduled(fixedRateString = "${scheduler.recovery.poll-interval-ms:60000}",
               initialDelayString = "${scheduler.recovery.initial-delay-ms:60000}")
    public void recoverStaleDispatches() {
        try (MDC.MDCCloseable ignored = CorrelationContext.openJobScope("recovery")) {
            dispatcher.recoverStale(clock.instant());
        } catch (Exception e) {
            log.error("Stale dispatch recovery failed", e);
        }
    }

    public Map<DispatchOutcome, Integer> runDigestTick(Instant now) {
        List<ScheduleEntry> due = persistence.findSelectableDigests().stream()
            .filter(entry -> dueWindowPolicy.isDue(entry, now))
            .toList();
        return dispatchAll(due);
    }

    public Map<DispatchOutcome, Integer> runFollowUpTick(Instant now) {
        return dispatchAll(persistence.findDueFollowUps(now, properties.getBatchSize()));
    }

    private Map<DispatchOutcome, Integer> dispatchAll(List<ScheduleEntry> entries) {
        Map<DispatchOutcome, Integer> outcomes = new EnumMap<>(DispatchOutcome.class);
        for (ScheduleEntry entry : entries) {
            try {
                outcomes.merge(dispatcher.dispatch(entry), 1, Integer::sum);
            } catch (RuntimeException e) {
                // Claim failed; the entry is untouched and is picked up again next tick
                log.error("Could not dispatch schedule {}: {}", entry.getId(), e.getMessage(), e);
                outcomes.merge(DispatchOutcome.FAILED, 1, Integer::sum);
            } finally {
                MDC.remove(CorrelationContext.SCHEDULE_ID_MDC_KEY);
            }
        }
        return outcomes;
    }

    private static void logSummary(String tick, Map<DispatchOutcome, Integer> outcomes) {
        if (!outcomes.isEmpty()) {
            log.info("{} tick finished: {}", tick, outcomes);
        }
    }
}
