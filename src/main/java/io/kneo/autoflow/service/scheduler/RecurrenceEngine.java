package io.kneo.autoflow.service.scheduler;

import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.model.scheduler.Occurrence;
import io.kneo.autoflow.model.scheduler.PlanningHorizon;
import io.kneo.autoflow.model.scheduler.Recurrence;
import io.kneo.autoflow.model.scheduler.Schedule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expands a schedule into the concrete occurrences that intersect a horizon.
 * Pure with respect to its inputs, safe to call from many threads.
 */
@ApplicationScoped
public class RecurrenceEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecurrenceEngine.class);
    // a Feb 29 yearly schedule can skip up to 8 years around a non-leap century
    private static final int NEXT_OCCURRENCE_LOOKAHEAD_DAYS = 366 * 8 + 1;

    private final ZoneId defaultZone;
    private final ScheduleValidator validator;

    @Inject
    public RecurrenceEngine(AutoFlowConfig config, ScheduleValidator validator) {
        this(config.getTimeZone(), validator);
    }

    public RecurrenceEngine(ZoneId defaultZone, ScheduleValidator validator) {
        this.defaultZone = defaultZone;
        this.validator = validator;
    }

    public List<Occurrence> expand(Schedule schedule, PlanningHorizon horizon) {
        return expand(schedule, horizon.from(), horizon.to());
    }

    /**
     * @throws InvalidScheduleException when the schedule is malformed
     */
    public List<Occurrence> expand(Schedule schedule, Instant from, Instant to) {
        List<String> errors = validator.validate(schedule);
        if (!errors.isEmpty()) {
            throw new InvalidScheduleException(errors);
        }
        if (!to.isAfter(from)) {
            return List.of();
        }
        if (schedule.isOneTime()) {
            Occurrence single = new Occurrence(schedule.getStartDateTime(), schedule.getEndDateTime(), false);
            return single.intersects(from, to) ? List.of(single) : List.of();
        }

        ZoneId zone = zoneOf(schedule);
        // start one day early so a window that began yesterday and spans midnight is seen
        LocalDate day = from.atZone(zone).toLocalDate().minusDays(1);
        LocalDate last = to.atZone(zone).toLocalDate();
        List<Occurrence> occurrences = new ArrayList<>();
        while (!day.isAfter(last)) {
            if (matches(schedule, day)) {
                windowOn(schedule, day, zone)
                        .filter(occurrence -> occurrence.intersects(from, to))
                        .ifPresent(occurrences::add);
            }
            day = day.plusDays(1);
        }
        return occurrences;
    }

    public Optional<Occurrence> nextOccurrence(Schedule schedule, Instant after) {
        if (schedule.isOneTime()) {
            return expand(schedule, after, Instant.MAX).stream()
                    .filter(o -> !o.start().isBefore(after))
                    .findFirst();
        }
        Instant to = after.atZone(zoneOf(schedule)).plusDays(NEXT_OCCURRENCE_LOOKAHEAD_DAYS).toInstant();
        return expand(schedule, after, to).stream()
                .filter(o -> !o.start().isBefore(after))
                .findFirst();
    }

    public ZoneId zoneOf(Schedule schedule) {
        return schedule.getTimeZone() != null ? schedule.getTimeZone() : defaultZone;
    }

    /**
     * 0 = Sunday .. 6 = Saturday.
     */
    public static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    private boolean matches(Schedule schedule, LocalDate day) {
        Recurrence recurrence = schedule.getRecurrence();
        return switch (recurrence) {
            case NONE -> false;
            case DAILY -> true;
            case WEEKLY -> schedule.getDaysOfWeek().contains(dayIndex(day));
            // a day that does not exist in the month never matches, so there is no rollover
            case MONTHLY -> day.getDayOfMonth() == schedule.getDayOfMonth();
            case YEARLY -> day.getMonthValue() == schedule.getMonth()
                    && day.getDayOfMonth() == schedule.getDayOfMonth();
        };
    }

    private Optional<Occurrence> windowOn(Schedule schedule, LocalDate day, ZoneId zone) {
        LocalTime startTime = schedule.getStartTime();
        LocalTime endTime = schedule.getEndTime();
        ZonedDateTime start = ZonedDateTime.of(day, startTime, zone);
        ZonedDateTime end;
        boolean openEnded = false;
        if (endTime == null) {
            // open-ended: claims the rest of the day for conflict purposes
            end = day.plusDays(1).atStartOfDay(zone);
            openEnded = true;
        } else if (endTime.isBefore(startTime)) {
            // end before start is an explicit overnight window ending on the following day
            end = ZonedDateTime.of(day.plusDays(1), endTime, zone);
        } else {
            end = ZonedDateTime.of(day, endTime, zone);
        }
        if (!end.isAfter(start)) {
            LOGGER.debug("Window {}-{} on {} collapses in zone {}, skipped", startTime, endTime, day, zone);
            return Optional.empty();
        }
        return Optional.of(new Occurrence(start.toInstant(), end.toInstant(), openEnded));
    }
}
