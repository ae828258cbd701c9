package io.kneo.autoflow.service;

import io.kneo.autoflow.model.FlowExecution;
import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.cnst.ExecutionMode;
import io.kneo.autoflow.model.cnst.ExecutionStatus;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.cnst.RunTrigger;
import io.kneo.autoflow.repository.FlowExecutionRepository;
import io.kneo.autoflow.service.exceptions.InvalidFlowStateException;
import io.kneo.autoflow.service.execution.FlowStepper;
import io.kneo.autoflow.service.execution.FlowTimelines;
import io.kneo.autoflow.service.execution.StepListener;
import io.kneo.autoflow.service.execution.TickScheduler;
import io.kneo.autoflow.service.execution.TimeScale;
import io.kneo.autoflow.service.execution.Timeline;
import io.kneo.autoflow.service.execution.TimelineSegment;
import io.kneo.autoflow.service.external.ActionDispatchChannel;
import io.kneo.autoflow.service.external.NoOpDispatchChannel;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live dispatcher. Each admitted run gets its own real-time stepper whose action starts are
 * emitted to the dispatch channel; a failing action is logged against the execution and the
 * stepper moves on.
 */
@ApplicationScoped
public class FlowRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowRunner.class);

    private final FlowService flowService;
    private final FlowTimelines timelines;
    private final FlowExecutionRepository executionRepository;
    private final ActionDispatchChannel dispatchChannel;
    private final ActionDispatchChannel dryRunChannel = new NoOpDispatchChannel();
    private final TickScheduler tickScheduler;
    private final Clock clock;
    private final Map<UUID, LiveRun> liveRuns = new ConcurrentHashMap<>();

    public record RunState(UUID flowId, String flowName, UUID executionId, Instant startedAt, RunTrigger triggeredBy,
                           boolean dryRun) {
    }

    @Inject
    public FlowRunner(FlowService flowService,
                      FlowTimelines timelines,
                      FlowExecutionRepository executionRepository,
                      ActionDispatchChannel dispatchChannel,
                      TickScheduler tickScheduler,
                      Clock clock) {
        this.flowService = flowService;
        this.timelines = timelines;
        this.executionRepository = executionRepository;
        this.dispatchChannel = dispatchChannel;
        this.tickScheduler = tickScheduler;
        this.clock = clock;
    }

    public Uni<FlowExecution> run(UUID flowId, RunTrigger triggeredBy, ExecutionMode mode) {
        if (liveRuns.containsKey(flowId)) {
            return Uni.createFrom().failure(new InvalidFlowStateException(flowId, FlowStatus.RUNNING, "run"));
        }
        Instant startedAt = clock.instant();
        return flowService.recordRun(flowId, startedAt, triggeredBy, mode)
                .chain(ticket -> {
                    FlowExecution execution = new FlowExecution();
                    execution.setFlowId(flowId);
                    execution.setFlowName(ticket.flow().getName());
                    execution.setStartedAt(startedAt);
                    execution.setTotalActions(ticket.flow().getActions().size());
                    execution.setTriggeredBy(triggeredBy);
                    execution.setDryRun(mode.isDryRun());
                    Uni<FlowExecution> logged;
                    if (mode.isDryRun()) {
                        execution.setId(UUID.randomUUID());
                        logged = Uni.createFrom().item(execution);
                    } else {
                        logged = executionRepository.insert(execution);
                    }
                    return logged
                            .onFailure().call(e -> flowService.completeRun(ticket, ExecutionStatus.FAILED))
                            .chain(saved -> start(ticket, saved));
                });
    }

    /**
     * Cancels a live run. Pending auto-advance timers are cancelled before the run is closed.
     */
    public Uni<FlowExecution> stop(UUID flowId) {
        LiveRun run = liveRuns.remove(flowId);
        if (run == null) {
            return flowService.get(flowId)
                    .chain(flow -> Uni.createFrom().<FlowExecution>failure(
                            new InvalidFlowStateException(flowId, flow.getStatus(), "stop")));
        }
        run.stopping = true;
        run.stepper.stop();
        LOGGER.info("Flow '{}' ({}) stopped", run.ticket.flow().getName(), flowId);
        return close(run, ExecutionStatus.CANCELLED);
    }

    public boolean isRunning(UUID flowId) {
        return liveRuns.containsKey(flowId);
    }

    public Collection<RunState> getCurrentRuns() {
        Collection<RunState> states = new ArrayList<>();
        liveRuns.values().forEach(run -> states.add(new RunState(
                run.ticket.flow().getId(),
                run.ticket.flow().getName(),
                run.execution.getId(),
                run.ticket.startedAt(),
                run.ticket.triggeredBy(),
                run.ticket.mode().isDryRun())));
        return states;
    }

    private Uni<FlowExecution> start(RunTicket ticket, FlowExecution execution) {
        UUID flowId = ticket.flow().getId();
        Timeline timeline = timelines.forRun(ticket.flow(), ticket.startedAt());
        ActionDispatchChannel channel = ticket.mode().isDryRun() ? dryRunChannel : dispatchChannel;
        LiveRun run = new LiveRun(ticket, execution);
        run.stepper = new FlowStepper(ticket.flow().getName(), timeline, tickScheduler, TimeScale.realTime(),
                new DispatchingListener(run, channel));
        if (liveRuns.putIfAbsent(flowId, run) != null) {
            return flowService.completeRun(ticket, ExecutionStatus.CANCELLED)
                    .chain(() -> Uni.createFrom().<FlowExecution>failure(
                            new InvalidFlowStateException(flowId, FlowStatus.RUNNING, "run")));
        }
        LOGGER.info("Running flow '{}' ({}): {} action(s), {}s{}", ticket.flow().getName(), flowId, timeline.size(),
                timeline.getTotalDuration().toSeconds(), timeline.isLooping() ? " looping" : "");
        run.stepper.play();
        return Uni.createFrom().item(execution);
    }

    private Uni<FlowExecution> close(LiveRun run, ExecutionStatus outcome) {
        FlowExecution execution = run.execution;
        ExecutionStatus status = outcome;
        synchronized (execution) {
            if (status == ExecutionStatus.COMPLETED && !execution.getFailures().isEmpty()
                    && execution.getActionsCompleted() == 0) {
                status = ExecutionStatus.FAILED;
                execution.setErrorMessage("No action could be dispatched");
            }
            execution.setStatus(status);
            execution.setEndedAt(clock.instant());
        }
        ExecutionStatus finalStatus = status;
        Uni<FlowExecution> logged = run.ticket.mode().isDryRun()
                ? Uni.createFrom().item(execution)
                : executionRepository.update(execution);
        return logged
                .call(() -> flowService.completeRun(run.ticket, finalStatus))
                .invoke(() -> LOGGER.info("Flow '{}' execution {} ended as {}, {}/{} action(s) dispatched, {} failure(s)",
                        execution.getFlowName(), execution.getId(), finalStatus.getValue(),
                        execution.getActionsCompleted(), execution.getTotalActions(), execution.getFailures().size()));
    }

    private static final class LiveRun {
        private final RunTicket ticket;
        private final FlowExecution execution;
        private FlowStepper stepper;
        private volatile boolean stopping;

        private LiveRun(RunTicket ticket, FlowExecution execution) {
            this.ticket = ticket;
            this.execution = execution;
        }
    }

    private final class DispatchingListener implements StepListener {
        private final LiveRun run;
        private final ActionDispatchChannel channel;

        private DispatchingListener(LiveRun run, ActionDispatchChannel channel) {
            this.run = run;
            this.channel = channel;
        }

        @Override
        public void onActionStarted(FlowStepper stepper, TimelineSegment segment, int cycle) {
            UUID flowId = run.ticket.flow().getId();
            FlowAction action = segment.action();
            Instant now = clock.instant();
            if (!segment.valid()) {
                String reason = String.join("; ", action.validate());
                LOGGER.warn("Flow {} skipped invalid action {} ({}): {}", flowId, segment.index(),
                        action.type().getValue(), reason);
                recordFailure(segment, cycle, reason, now);
                return;
            }
            try {
                channel.emit(flowId, action, now);
                synchronized (run.execution) {
                    run.execution.setActionsCompleted(run.execution.getActionsCompleted() + 1);
                }
            } catch (RuntimeException e) {
                LOGGER.warn("Flow {} failed to dispatch action {} ({})", flowId, segment.index(),
                        action.type().getValue(), e);
                recordFailure(segment, cycle, e.getMessage(), now);
            }
        }

        @Override
        public void onFinished(FlowStepper stepper, boolean completed) {
            UUID flowId = run.ticket.flow().getId();
            if (run.stopping || !liveRuns.remove(flowId, run)) {
                return;
            }
            close(run, completed ? ExecutionStatus.COMPLETED : ExecutionStatus.CANCELLED)
                    .subscribe().with(
                            execution -> LOGGER.debug("Execution {} closed", execution.getId()),
                            failure -> LOGGER.error("Failed to close execution of flow {}", flowId, failure)
                    );
        }

        private void recordFailure(TimelineSegment segment, int cycle, String reason, Instant at) {
            synchronized (run.execution) {
                run.execution.getFailures().add(new FlowExecution.ActionFailure(
                        segment.index(), cycle, segment.action().type().getValue(), reason, at));
            }
        }
    }
}
