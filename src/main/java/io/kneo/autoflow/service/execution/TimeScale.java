package io.kneo.autoflow.service.execution;

import java.time.Duration;

/**
 * Maps timeline time to wall-clock dwell time. Live dispatch runs in real time, previews run faster.
 */
public interface TimeScale {

    Duration toWallClock(Duration timelineTime);

    Duration toTimeline(Duration wallClock);

    static TimeScale realTime() {
        return new TimeScale() {
            @Override
            public Duration toWallClock(Duration timelineTime) {
                return timelineTime;
            }

            @Override
            public Duration toTimeline(Duration wallClock) {
                return wallClock;
            }
        };
    }

    static TimeScale speedUp(double factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("Speed-up factor must be positive");
        }
        return new TimeScale() {
            @Override
            public Duration toWallClock(Duration timelineTime) {
                return Duration.ofNanos((long) (timelineTime.toNanos() / factor));
            }

            @Override
            public Duration toTimeline(Duration wallClock) {
                return Duration.ofNanos((long) (wallClock.toNanos() * factor));
            }
        };
    }
}
