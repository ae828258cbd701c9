package io.kneo.autoflow.service.execution;

import io.smallrye.mutiny.subscription.Cancellable;

import java.time.Duration;

/**
 * One-shot timers plus a monotonic clock, injected into steppers so tests can drive time.
 */
public interface TickScheduler {

    long nowMillis();

    Cancellable schedule(Duration delay, Runnable task);
}
