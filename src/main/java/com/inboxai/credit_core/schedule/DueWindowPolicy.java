package com.inboxai.credit_core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Decides whether a schedule entry is due at a given instant. Pure: {@code now} is always
 * an argument, never read from a clock.
 *
 * A digest is due when now falls in [target, target + window] for today's or yesterday's
 * occurrence of its time of day (in its own timezone), and more than the cooldown has passed
 * since its last successful run. A follow-up is due once its scheduled time has passed.
 */
public class DueWindowPolicy {

    private final Duration window;
    private final Duration cooldown;

    public DueWindowPolicy(Duration window, Duration cooldown) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Due window must be positive");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown cannot be negative");
        }
        this.window = window;
        this.cooldown = cooldown;
    }

    public boolean isDue(ScheduleEntry entry, Instant now) {
        if (!entry.isSelectable()) {
            return false;
        }
        return switch (entry.getKind()) {
            case DIGEST -> dueOccurrence(entry, now).isPresent() && isCooledDown(entry, now);
            case FOLLOW_UP -> entry.getScheduledAt() != null && !entry.getScheduledAt().isAfter(now);
        };
    }

    /**
     * The occurrence whose window contains {@code now}, if any. Checking yesterday as well covers
     * a window that crosses local midnight.
     */
    public Optional<Instant> dueOccurrence(ScheduleEntry entry, Instant now) {
        ZoneId zone = entry.zoneId();
        LocalDate today = now.atZone(zone).toLocalDate();

        for (LocalDate date : new LocalDate[] {today, today.minusDays(1)}) {
            Instant target = ZonedDateTime.of(date, entry.getScheduleTime(), zone).toInstant();
            Duration elapsed = Duration.between(target, now);
            if (!elapsed.isNegative() && elapsed.compareTo(window) <= 0) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    public boolean isCooledDown(ScheduleEntry entry, Instant now) {
        return entry.getLastRunAt() == null
            || Duration.between(entry.getLastRunAt(), now).compareTo(cooldown) > 0;
    }

    /**
     * First occurrence of the digest's time of day strictly after {@code after}.
     * Follow-ups have no next occurrence.
     */
    public Instant nextOccurrence(ScheduleEntry entry, Instant after) {
        if (entry.getKind() != ScheduleKind.DIGEST) {
            return null;
        }
        ZoneId zone = entry.zoneId();
        LocalDate date = after.atZone(zone).toLocalDate();
        Instant candidate = ZonedDateTime.of(date, entry.getScheduleTime(), zone).toInstant();
        while (!candidate.isAfter(after)) {
            date = date.plusDays(1);
            candidate = ZonedDateTime.of(date, entry.getScheduleTime(), zone).toInstant();
        }
        return candidate;
    }

    public Duration window() {
        return window;
    }

    public Duration cooldown() {
        return cooldown;
    }
}
