package io.kneo.autoflow.model.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open window {@code [from, to)} over which schedules are expanded.
 */
public record PlanningHorizon(Instant from, Instant to) {

    public PlanningHorizon {
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Horizon end must be after its start");
        }
    }

    public static PlanningHorizon ofDays(Instant from, int days) {
        return new PlanningHorizon(from, from.plus(Duration.ofDays(days)));
    }
}
