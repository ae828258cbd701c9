package io.kneo.autoflow.model.scheduler;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Set;
import java.util.TreeSet;

/**
 * Either a one-time window (recurrence NONE with absolute datetimes) or a recurring
 * time-of-day window with its recurrence selector. Days of week are 0 = Sunday .. 6 = Saturday.
 */
@Setter
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Schedule {
    @Builder.Default
    private Recurrence recurrence = Recurrence.NONE;
    private Instant startDateTime;
    private Instant endDateTime;
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime startTime;
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime endTime;
    private Set<Integer> daysOfWeek;
    private Integer dayOfMonth;
    private Integer month;
    private ZoneId timeZone;

    @JsonIgnore
    public boolean isOneTime() {
        return recurrence == null || recurrence == Recurrence.NONE;
    }

    @JsonIgnore
    public boolean isOpenEnded() {
        return !isOneTime() && endTime == null;
    }

    @JsonIgnore
    public boolean spansMidnight() {
        return !isOneTime() && startTime != null && endTime != null && endTime.isBefore(startTime);
    }

    public Schedule copy() {
        Schedule copy = toBuilder().build();
        if (daysOfWeek != null) {
            copy.setDaysOfWeek(new TreeSet<>(daysOfWeek));
        }
        return copy;
    }
}
