package io.kneo.autoflow.service.execution;

import io.smallrye.mutiny.subscription.Cancellable;
import io.vertx.mutiny.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;

@ApplicationScoped
public class VertxTickScheduler implements TickScheduler {
    private final Vertx vertx;

    @Inject
    public VertxTickScheduler(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public long nowMillis() {
        return System.nanoTime() / 1_000_000;
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        // vert.x rejects delays below one millisecond
        long timerId = vertx.setTimer(Math.max(1, delay.toMillis()), id -> task.run());
        return () -> vertx.cancelTimer(timerId);
    }
}
