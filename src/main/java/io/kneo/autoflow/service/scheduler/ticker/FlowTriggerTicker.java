package io.kneo.autoflow.service.scheduler.ticker;

import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.model.cnst.ExecutionMode;
import io.kneo.autoflow.model.cnst.RunTrigger;
import io.kneo.autoflow.service.FlowRunner;
import io.kneo.autoflow.service.exceptions.InvalidFlowStateException;
import io.kneo.autoflow.service.scheduler.FlowTriggerRegistry;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires registered flows whose occurrence started since the previous tick. Flows due at the
 * same instant start in priority order. A flow still running from its previous occurrence is
 * restarted only when its schedule is open ended; otherwise the trigger is rejected.
 */
@ApplicationScoped
public class FlowTriggerTicker {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowTriggerTicker.class);

    private final FlowTriggerRegistry registry;
    private final FlowRunner flowRunner;
    private final AutoFlowConfig config;
    private final Clock clock;

    private final AtomicReference<Instant> lastTick = new AtomicReference<>();
    private final AtomicInteger totalFired = new AtomicInteger();
    private final AtomicInteger totalErrors = new AtomicInteger();
    private final AtomicInteger totalRejected = new AtomicInteger();

    @Inject
    public FlowTriggerTicker(FlowTriggerRegistry registry, FlowRunner flowRunner, AutoFlowConfig config, Clock clock) {
        this.registry = registry;
        this.flowRunner = flowRunner;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(every = "${autoflow.trigger.interval:30s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        fireDue(clock.instant());
    }

    /**
     * @return ids of the flows started in this tick, in start order
     */
    public List<UUID> fireDue(Instant now) {
        Instant previous = lastTick.getAndSet(now);
        Instant from = previous == null ? now.minus(config.getTriggerInterval()) : previous;
        if (!now.isAfter(from)) {
            return List.of();
        }
        List<FlowTriggerRegistry.Due> due = registry.dueBetween(from, now);
        LOGGER.debug("Trigger tick [{}, {}): {} flow(s) due", from, now, due.size());
        for (FlowTriggerRegistry.Due entry : due) {
            UUID flowId = entry.registration().flowId();
            totalFired.incrementAndGet();
            boolean preempt = entry.registration().schedule().isOpenEnded() && flowRunner.isRunning(flowId);
            Uni<?> previousRun = preempt
                    ? flowRunner.stop(flowId)
                    : Uni.createFrom().voidItem();
            previousRun
                    .chain(() -> flowRunner.run(flowId, RunTrigger.SCHEDULE, ExecutionMode.LIVE))
                    .subscribe().with(
                            execution -> LOGGER.info("Scheduled run of '{}' started for window {}",
                                    entry.registration().name(), entry.occurrence().start()),
                            error -> {
                                if (error instanceof InvalidFlowStateException) {
                                    totalRejected.incrementAndGet();
                                    LOGGER.warn("Scheduled run of '{}' for window {} rejected: {}",
                                            entry.registration().name(), entry.occurrence().start(), error.getMessage());
                                } else {
                                    totalErrors.incrementAndGet();
                                    LOGGER.error("Scheduled run of flow {} failed to start", flowId, error);
                                }
                            }
                    );
        }
        return due.stream().map(d -> d.registration().flowId()).toList();
    }

    public Instant getLastTick() {
        return lastTick.get();
    }

    public int getTotalFired() {
        return totalFired.get();
    }

    public int getTotalErrors() {
        return totalErrors.get();
    }

    public int getTotalRejected() {
        return totalRejected.get();
    }
}
