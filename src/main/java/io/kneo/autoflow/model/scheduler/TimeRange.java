package io.kneo.autoflow.model.scheduler;

import java.time.Instant;

public record TimeRange(Instant start, Instant end) {

    public static TimeRange intersection(Occurrence a, Occurrence b) {
        Instant start = a.start().isAfter(b.start()) ? a.start() : b.start();
        Instant end = a.end().isBefore(b.end()) ? a.end() : b.end();
        return new TimeRange(start, end);
    }
}
