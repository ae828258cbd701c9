package io.kneo.autoflow.service.scheduler;

import io.kneo.autoflow.model.scheduler.Recurrence;
import io.kneo.autoflow.model.scheduler.Schedule;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Month;
import java.util.ArrayList;
import java.util.List;

@ApplicationScoped
public class ScheduleValidator {

    public List<String> validate(Schedule schedule) {
        List<String> errors = new ArrayList<>();
        if (schedule == null) {
            errors.add("Schedule is required");
            return errors;
        }
        Recurrence recurrence = schedule.getRecurrence() == null ? Recurrence.NONE : schedule.getRecurrence();
        if (recurrence == Recurrence.NONE) {
            validateOneTime(schedule, errors);
        } else {
            validateRecurring(schedule, recurrence, errors);
        }
        return errors;
    }

    private void validateOneTime(Schedule schedule, List<String> errors) {
        if (schedule.getStartDateTime() == null || schedule.getEndDateTime() == null) {
            errors.add("One-time schedule requires start and end datetime");
        } else if (!schedule.getEndDateTime().isAfter(schedule.getStartDateTime())) {
            errors.add("End datetime must be after start datetime");
        }
        if (schedule.getStartTime() != null || schedule.getEndTime() != null) {
            errors.add("One-time schedule must not carry a time of day");
        }
        if (hasDays(schedule) || schedule.getDayOfMonth() != null || schedule.getMonth() != null) {
            errors.add("One-time schedule must not carry recurrence selectors");
        }
    }

    private void validateRecurring(Schedule schedule, Recurrence recurrence, List<String> errors) {
        if (schedule.getStartDateTime() != null || schedule.getEndDateTime() != null) {
            errors.add("Recurring schedule must not carry absolute datetimes");
        }
        if (schedule.getStartTime() == null) {
            errors.add("Start time is required");
        } else if (schedule.getStartTime().equals(schedule.getEndTime())) {
            errors.add("End time must differ from start time");
        }

        if (recurrence == Recurrence.WEEKLY) {
            if (!hasDays(schedule)) {
                errors.add("Weekly schedule requires at least one day of week");
            } else if (schedule.getDaysOfWeek().stream().anyMatch(d -> d == null || d < 0 || d > 6)) {
                errors.add("Days of week must be between 0 (Sunday) and 6 (Saturday)");
            }
        } else if (hasDays(schedule)) {
            errors.add("Days of week apply to weekly schedules only");
        }

        if (recurrence == Recurrence.MONTHLY || recurrence == Recurrence.YEARLY) {
            Integer day = schedule.getDayOfMonth();
            if (day == null || day < 1 || day > 31) {
                errors.add("Day of month must be between 1 and 31");
            }
        } else if (schedule.getDayOfMonth() != null) {
            errors.add("Day of month applies to monthly and yearly schedules only");
        }

        if (recurrence == Recurrence.YEARLY) {
            Integer month = schedule.getMonth();
            if (month == null || month < 1 || month > 12) {
                errors.add("Month must be between 1 and 12");
            } else if (schedule.getDayOfMonth() != null && schedule.getDayOfMonth() > Month.of(month).maxLength()) {
                errors.add(String.format("Day %d never occurs in %s", schedule.getDayOfMonth(), Month.of(month)));
            }
        } else if (schedule.getMonth() != null) {
            errors.add("Month applies to yearly schedules only");
        }
    }

    private boolean hasDays(Schedule schedule) {
        return schedule.getDaysOfWeek() != null && !schedule.getDaysOfWeek().isEmpty();
    }
}
