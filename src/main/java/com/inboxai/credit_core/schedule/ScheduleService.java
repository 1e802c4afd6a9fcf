package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.config.SchedulerProperties;
import com.inboxai.credit_core.credit.CreditAuthority;
import com.inboxai.credit_core.ledger.CreditBalance;
import com.inboxai.credit_core.ledger.SubscriptionTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * Creates and manages schedule entries on behalf of a tenant.
 *
 * Every lookup is scoped to the calling (user, org): an entry owned by another tenant is
 * reported as not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private static final int MAX_LIST_SIZE = 200;

    private final SchedulePersistenceService persistence;
    private final CreditAuthority creditAuthority;
    private final DueWindowPolicy dueWindowPolicy;
    private final SchedulerProperties properties;
    private final Clock clock;

    public ScheduleEntry createDigest(UUID userId, UUID orgId, UUID ownerId, LocalTime scheduleTime,
                                      String timezone, String recipient, String criteriaType, Integer maxRetries) {
        Instant now = clock.instant();
        ScheduleEntry entry = ScheduleEntry.digest(userId, orgId, ownerId, scheduleTime, timezone, recipient,
            criteriaType, resolveMaxRetries(maxRetries), now);
        entry = entry.toBuilder().nextRunAt(dueWindowPolicy.nextOccurrence(entry, now)).build();

        ScheduleEntry saved = persistence.save(entry);
        log.info("Digest schedule {} created: time={} {}, criteria={}",
            saved.getId(), saved.getScheduleTime(), saved.getTimezone(), saved.getCriteriaType());
        return saved;
    }

    /**
     * Rejects the follow-up when the tenant already has as many open follow-ups as its tier allows.
     * The balance row is locked before counting, so concurrent requests for one tenant are checked
     * one at a time.
     */
    @Transactional
    public ScheduleEntry createFollowUp(UUID userId, UUID orgId, UUID ownerId, Instant scheduledAt,
                                        String recipient, FollowUpType followUpType,
                                        String templateMessage, Integer maxRetries) {
        SubscriptionTier tier = creditAuthority.lockBalance(userId, orgId)
            .map(CreditBalance::getSubscriptionTier)
            .orElse(SubscriptionTier.FREE);
        long open = persistence.countOpenFollowUps(userId, orgId);
        if (open >= tier.maxPendingFollowUps()) {
            log.info("Follow-up rejected: {} open, {} tier limit is {}", open, tier.code(), tier.maxPendingFollowUps());
            throw new TierLimitExceededException(tier, tier.maxPendingFollowUps());
        }

        ScheduleEntry entry = ScheduleEntry.followUp(userId, orgId, ownerId, scheduledAt, recipient,
            followUpType, templateMessage, resolveMaxRetries(maxRetries), clock.instant());
        ScheduleEntry saved = persistence.save(entry);
        log.info("Follow-up {} scheduled for {}", saved.getId(), saved.getScheduledAt());
        return saved;
    }

    public ScheduleEntry get(UUID userId, UUID orgId, UUID scheduleId) {
        return persistence.findById(scheduleId)
            .filter(entry -> entry.getUserId().equals(userId) && entry.getOrgId().equals(orgId))
            .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    public List<ScheduleEntry> list(UUID userId, UUID orgId, int limit) {
        return persistence.findForTenant(userId, orgId, Math.max(1, Math.min(limit, MAX_LIST_SIZE)));
    }

    public ScheduleEntry deactivate(UUID userId, UUID orgId, UUID scheduleId) {
        get(userId, orgId, scheduleId);
        ScheduleEntry updated = persistence.update(scheduleId, entry -> entry.deactivate(clock.instant()));
        log.info("Schedule {} deactivated", scheduleId);
        return updated;
    }

    public ScheduleEntry activate(UUID userId, UUID orgId, UUID scheduleId) {
        get(userId, orgId, scheduleId);
        Instant now = clock.instant();
        ScheduleEntry updated = persistence.update(scheduleId,
            entry -> entry.activate(now, dueWindowPolicy.nextOccurrence(entry, now)));
        log.info("Schedule {} activated", scheduleId);
        return updated;
    }

    public ScheduleEntry cancel(UUID userId, UUID orgId, UUID scheduleId, String reason) {
        get(userId, orgId, scheduleId);
        ScheduleEntry cancelled = persistence.cancel(scheduleId, reason, clock.instant());
        log.info("Schedule {} cancelled: {}", scheduleId, cancelled.getCancellationReason());
        return cancelled;
    }

    private int resolveMaxRetries(Integer requested) {
        return requested != null ? requested : properties.getDefaultMaxRetries();
    }
}
