package com.enterprise.autosave.recurrence;

import com.cronutils.model.time.ExecutionTime;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed and validated form of a five-field recurrence expression, bound to a timezone.
 * Instances are immutable and only created by {@link RecurrenceParser}.
 *
 * <p>Matching is delegated to cron-utils {@link ExecutionTime}s evaluated on wall-clock time.
 * A fire is the earliest next execution among the schedules, optionally restricted to the days
 * accepted by a day-of-week filter. The wall-clock result is then placed in the zone: gap times
 * are shifted forward, overlaps resolve to the earlier offset.
 */
public final class RecurrenceDescriptor {
    
    /**
     * Upper bound on how far ahead a fire instant is searched. A full leap-year and weekday
     * cycle, so a 29th of February on a given weekday is always found.
     */
    static final int MAX_SEARCH_YEARS = 28;
    
    // Repeated wall-clock minutes of one fall-back overlap
    private static final int MAX_OVERLAP_STEPS = 24 * 60;
    
    private final String expression;
    private final String normalized;
    private final ZoneId zone;
    private final List<ExecutionTime> schedules;
    private final ExecutionTime dayOfWeekFilter;
    
    RecurrenceDescriptor(String expression, String normalized, ZoneId zone,
                         List<ExecutionTime> schedules, ExecutionTime dayOfWeekFilter) {
        this.expression = expression;
        this.normalized = normalized;
        this.zone = zone;
        this.schedules = List.copyOf(schedules);
        this.dayOfWeekFilter = dayOfWeekFilter;
    }
    
    public String getExpression() { return expression; }
    public ZoneId getZone() { return zone; }
    
    /**
     * Earliest instant strictly after {@code from} that satisfies every field, evaluated in this
     * descriptor's timezone.
     *
     * @throws IllegalStateException if no instant matches within the search horizon, which a
     *                               descriptor produced by the parser never does
     */
    public Instant nextFireAfter(Instant from) {
        return findNextFire(from).orElseThrow(() -> new IllegalStateException(
            "No fire time within " + MAX_SEARCH_YEARS + " years for expression: " + expression));
    }
    
    /**
     * Whether the given instant, seen in this descriptor's timezone, falls on a matching minute
     */
    public boolean matches(Instant instant) {
        LocalDateTime local = instant.atZone(zone).toLocalDateTime().truncatedTo(ChronoUnit.MINUTES);
        if (dayOfWeekFilter != null && !firesAt(dayOfWeekFilter, local.truncatedTo(ChronoUnit.DAYS))) {
            return false;
        }
        for (ExecutionTime schedule : schedules) {
            if (firesAt(schedule, local)) {
                return true;
            }
        }
        return false;
    }
    
    Optional<Instant> findNextFire(Instant from) {
        Objects.requireNonNull(from, "Reference instant cannot be null");
        LocalDateTime cursor = LocalDateTime.ofInstant(from, zone).truncatedTo(ChronoUnit.MINUTES);
        LocalDateTime limit = cursor.plusYears(MAX_SEARCH_YEARS);
    
        for (int step = 0; step < MAX_OVERLAP_STEPS; step++) {
            Optional<LocalDateTime> next = nextWallClockFire(cursor, limit);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            Instant fireAt = ZonedDateTime.ofLocal(next.get(), zone, null).toInstant();
            if (fireAt.isAfter(from)) {
                return Optional.of(fireAt);
            }
            cursor = next.get();
        }
        return Optional.empty();
    }
    
    private Optional<LocalDateTime> nextWallClockFire(LocalDateTime cursor, LocalDateTime limit) {
        Optional<LocalDateTime> earliest = Optional.empty();
        for (ExecutionTime schedule : schedules) {
            Optional<LocalDateTime> next = nextFiltered(schedule, cursor, limit);
            if (next.isPresent() && (earliest.isEmpty() || next.get().isBefore(earliest.get()))) {
                earliest = next;
            }
        }
        return earliest;
    }
    
    private Optional<LocalDateTime> nextFiltered(ExecutionTime schedule, LocalDateTime cursor, LocalDateTime limit) {
        LocalDateTime searchFrom = cursor;
        while (true) {
            Optional<LocalDateTime> next = nextExecution(schedule, searchFrom);
            if (next.isEmpty() || next.get().isAfter(limit)) {
                return Optional.empty();
            }
            LocalDateTime candidate = next.get();
            if (dayOfWeekFilter == null || firesAt(dayOfWeekFilter, candidate.truncatedTo(ChronoUnit.DAYS))) {
                return next;
            }
            searchFrom = candidate.toLocalDate().atTime(23, 59);
        }
    }
    
    // Wall-clock arithmetic runs in UTC, which has no offset transitions
    private static Optional<LocalDateTime> nextExecution(ExecutionTime schedule, LocalDateTime after) {
        return schedule.nextExecution(after.atZone(ZoneOffset.UTC).plusSeconds(1))
            .map(ZonedDateTime::toLocalDateTime);
    }
    
    static boolean firesAt(ExecutionTime schedule, LocalDateTime minute) {
        ZonedDateTime at = minute.atZone(ZoneOffset.UTC);
        return schedule.nextExecution(at.minusSeconds(1))
            .map(at::isEqual)
            .orElse(false);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecurrenceDescriptor that = (RecurrenceDescriptor) o;
        return normalized.equals(that.normalized) && zone.equals(that.zone);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(normalized, zone);
    }
    
    @Override
    public String toString() {
        return "RecurrenceDescriptor{" +
                "expression='" + expression + '\'' +
                ", zone=" + zone +
                '}';
    }
}
