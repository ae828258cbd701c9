package io.kneo.autoflow.model.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * One concrete broadcast window produced by expanding a schedule. Never persisted.
 */
public record Occurrence(Instant start, Instant end, boolean openEnded) {

    public Occurrence {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Occurrence end " + end + " must be after start " + start);
        }
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean intersects(Instant from, Instant to) {
        return start.isBefore(to) && from.isBefore(end);
    }
}
