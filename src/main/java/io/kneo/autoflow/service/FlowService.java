package io.kneo.autoflow.service;

import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.dto.FlowDraftDTO;
import io.kneo.autoflow.dto.FlowPatchDTO;
import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.FlowExecution;
import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.cnst.ExecutionMode;
import io.kneo.autoflow.model.cnst.ExecutionStatus;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.cnst.RunTrigger;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.model.scheduler.Occurrence;
import io.kneo.autoflow.model.scheduler.PlanningHorizon;
import io.kneo.autoflow.repository.FlowExecutionRepository;
import io.kneo.autoflow.repository.FlowRepository;
import io.kneo.autoflow.service.exceptions.FlowConflictException;
import io.kneo.autoflow.service.exceptions.FlowValidationException;
import io.kneo.autoflow.service.exceptions.InvalidFlowStateException;
import io.kneo.autoflow.service.external.FlowDescriptionParser;
import io.kneo.autoflow.service.scheduler.ConflictingFlow;
import io.kneo.autoflow.service.scheduler.FlowCandidate;
import io.kneo.autoflow.service.scheduler.FlowTriggerRegistry;
import io.kneo.autoflow.service.scheduler.InvalidScheduleException;
import io.kneo.autoflow.service.scheduler.OverlapDetector;
import io.kneo.autoflow.service.scheduler.RecurrenceEngine;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * The flow aggregate. Every mutation validates fully, then checks conflicts, then saves once;
 * a failure at any stage leaves the stored flow untouched.
 */
@ApplicationScoped
public class FlowService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowService.class);

    private final FlowRepository repository;
    private final FlowExecutionRepository executionRepository;
    private final RecurrenceEngine recurrenceEngine;
    private final OverlapDetector overlapDetector;
    private final FlowValidator flowValidator;
    private final FlowTriggerRegistry triggerRegistry;
    private final AutoFlowConfig config;
    private final Clock clock;
    private final Map<UUID, RunTicket> activeRuns = new ConcurrentHashMap<>();

    @Inject
    Instance<FlowDescriptionParser> descriptionParsers;

    @Inject
    public FlowService(FlowRepository repository,
                       FlowExecutionRepository executionRepository,
                       RecurrenceEngine recurrenceEngine,
                       OverlapDetector overlapDetector,
                       FlowValidator flowValidator,
                       FlowTriggerRegistry triggerRegistry,
                       AutoFlowConfig config,
                       Clock clock) {
        this.repository = repository;
        this.executionRepository = executionRepository;
        this.recurrenceEngine = recurrenceEngine;
        this.overlapDetector = overlapDetector;
        this.flowValidator = flowValidator;
        this.triggerRegistry = triggerRegistry;
        this.config = config;
        this.clock = clock;
    }

    public Uni<Flow> get(UUID id) {
        return repository.findById(id);
    }

    public Uni<List<Flow>> list() {
        return repository.getAll();
    }

    public Uni<List<Flow>> listActive() {
        return repository.getAll()
                .map(flows -> flows.stream()
                        .filter(flow -> flow.getStatus().takesPartInConflictCheck())
                        .toList());
    }

    public Uni<Flow> create(FlowDraftDTO draft, boolean force, ExecutionMode mode) {
        Flow flow = new Flow();
        flow.setName(draft.getName());
        flow.setNameHe(draft.getNameHe());
        flow.setDescription(draft.getDescription());
        flow.setDescriptionHe(draft.getDescriptionHe());
        flow.setActions(draft.getActions() == null ? new ArrayList<>() : new ArrayList<>(draft.getActions()));
        flow.setTriggerType(draft.getTriggerType());
        flow.setSchedule(draft.getSchedule() == null ? null : draft.getSchedule().copy());
        flow.setPriority(draft.getPriority());
        flow.setLoop(draft.isLoop());
        flow.setStatus(FlowStatus.ACTIVE);

        List<String> errors = flowValidator.validate(flow);
        if (!errors.isEmpty()) {
            return Uni.createFrom().failure(new FlowValidationException(errors));
        }
        return findConflicts(flow)
                .chain(conflicts -> {
                    if (!conflicts.isEmpty()) {
                        if (!force) {
                            LOGGER.warn("Flow '{}' rejected, conflicts with {} flow(s)", flow.getName(), conflicts.size());
                            return Uni.createFrom().failure(new FlowConflictException(conflicts));
                        }
                        LOGGER.warn("Flow '{}' conflicts with {} flow(s), saving as disabled", flow.getName(), conflicts.size());
                        flow.setStatus(FlowStatus.DISABLED);
                    }
                    Instant now = clock.instant();
                    flow.setCreatedAt(now);
                    flow.setUpdatedAt(now);
                    if (mode.isDryRun()) {
                        LOGGER.debug("Dry run: flow '{}' passed validation", flow.getName());
                        return Uni.createFrom().item(flow);
                    }
                    return repository.save(flow)
                            .invoke(saved -> {
                                triggerRegistry.sync(saved);
                                LOGGER.info("Created flow '{}' ({}) as {}", saved.getName(), saved.getId(),
                                        saved.getStatus().getValue());
                            });
                });
    }

    public Uni<Flow> update(UUID id, FlowPatchDTO patch, boolean force, ExecutionMode mode) {
        return mutable(id, "update")
                .chain(stored -> {
                    Flow flow = stored.copy();
                    applyPatch(flow, patch);
                    List<String> errors = flowValidator.validate(flow);
                    if (!errors.isEmpty()) {
                        return Uni.createFrom().failure(new FlowValidationException(errors));
                    }
                    return findConflicts(flow)
                            .chain(conflicts -> {
                                if (!conflicts.isEmpty()) {
                                    if (!force) {
                                        return Uni.createFrom().failure(new FlowConflictException(conflicts));
                                    }
                                    LOGGER.warn("Update of flow {} conflicts with {} flow(s), disabling it", id, conflicts.size());
                                    flow.setStatus(FlowStatus.DISABLED);
                                }
                                return persist(flow, mode, "Updated");
                            });
                });
    }

    public Uni<Integer> delete(UUID id) {
        return mutable(id, "delete")
                .chain(flow -> repository.delete(id))
                .invoke(count -> {
                    triggerRegistry.unregister(id);
                    LOGGER.info("Deleted flow {}", id);
                });
    }

    /**
     * active -> paused, paused/disabled -> active. Resuming re-checks conflicts.
     */
    public Uni<Flow> toggle(UUID id) {
        return mutable(id, "toggle")
                .chain(stored -> {
                    Flow flow = stored.copy();
                    if (flow.getStatus() == FlowStatus.ACTIVE) {
                        flow.setStatus(FlowStatus.PAUSED);
                        return persist(flow, ExecutionMode.LIVE, "Paused");
                    }
                    flow.setStatus(FlowStatus.ACTIVE);
                    return findConflicts(flow)
                            .chain(conflicts -> {
                                if (!conflicts.isEmpty()) {
                                    LOGGER.warn("Flow {} cannot be resumed, conflicts with {} flow(s)", id, conflicts.size());
                                    return Uni.createFrom().failure(new FlowConflictException(conflicts));
                                }
                                return persist(flow, ExecutionMode.LIVE, "Resumed");
                            });
                });
    }

    /**
     * Returns a flow left in {@code running} without a live run back to {@code active}.
     * A flow whose run is still admitted cannot be reset; stop the run instead.
     */
    public Uni<Flow> resetStuck(UUID id) {
        return repository.findById(id)
                .chain(stored -> {
                    if (activeRuns.containsKey(id)) {
                        return Uni.createFrom().failure(new InvalidFlowStateException(id, FlowStatus.RUNNING, "reset"));
                    }
                    if (!stored.isRunning()) {
                        return Uni.createFrom().item(stored);
                    }
                    Flow flow = stored.copy();
                    flow.setStatus(FlowStatus.ACTIVE);
                    LOGGER.warn("Resetting stuck flow {}", id);
                    return persist(flow, ExecutionMode.LIVE, "Reset");
                });
    }

    public Uni<Flow> addAction(UUID id, FlowAction action, Integer atIndex) {
        return mutateActions(id, "add action to", actions -> {
            int index = atIndex == null ? actions.size() : atIndex;
            if (index < 0 || index > actions.size()) {
                throw new FlowValidationException(String.format("Insert position %d is outside 0..%d", index, actions.size()));
            }
            List<String> errors = flowValidator.validateAction(action, index);
            if (!errors.isEmpty()) {
                throw new FlowValidationException(errors);
            }
            actions.add(index, action);
        });
    }

    public Uni<Flow> removeAction(UUID id, int index) {
        return mutateActions(id, "remove action from", actions -> {
            checkIndex(index, actions.size());
            actions.remove(index);
        });
    }

    public Uni<Flow> reorderActions(UUID id, int fromIndex, int toIndex) {
        return mutateActions(id, "reorder actions of", actions -> {
            checkIndex(fromIndex, actions.size());
            checkIndex(toIndex, actions.size());
            actions.add(toIndex, actions.remove(fromIndex));
        });
    }

    /**
     * Admits a run: rejects a flow that is already running, then bumps the run counter and marks
     * it running. Dry runs are admitted without touching the stored flow.
     */
    public Uni<RunTicket> recordRun(UUID id, Instant at, RunTrigger triggeredBy, ExecutionMode mode) {
        return repository.findById(id)
                .chain(stored -> {
                    if (stored.isRunning() || activeRuns.containsKey(id)) {
                        return Uni.createFrom().failure(new InvalidFlowStateException(id, FlowStatus.RUNNING, "run"));
                    }
                    if (mode.isDryRun()) {
                        return Uni.createFrom().item(new RunTicket(stored.copy(), stored.getStatus(), at, triggeredBy, mode));
                    }
                    RunTicket ticket = new RunTicket(stored.copy(), stored.getStatus(), at, triggeredBy, mode);
                    if (activeRuns.putIfAbsent(id, ticket) != null) {
                        return Uni.createFrom().failure(new InvalidFlowStateException(id, FlowStatus.RUNNING, "run"));
                    }
                    Flow flow = stored.copy();
                    flow.setRunCount(flow.getRunCount() + 1);
                    if (flow.getLastRun() == null || at.isAfter(flow.getLastRun())) {
                        flow.setLastRun(at);
                    }
                    flow.setStatus(FlowStatus.RUNNING);
                    flow.setUpdatedAt(clock.instant());
                    return repository.save(flow)
                            .onFailure().invoke(e -> activeRuns.remove(id, ticket))
                            .map(saved -> {
                                LOGGER.info("Flow '{}' ({}) started, triggered by {}", saved.getName(), id,
                                        triggeredBy.getValue());
                                return ticket;
                            });
                });
    }

    /**
     * Ends a run. The prior status is restored only if nobody changed the status meanwhile.
     */
    public Uni<Flow> completeRun(RunTicket ticket, ExecutionStatus outcome) {
        UUID id = ticket.flow().getId();
        if (ticket.mode().isDryRun()) {
            return repository.findById(id);
        }
        activeRuns.remove(id, ticket);
        return repository.findById(id)
                .chain(stored -> {
                    if (!stored.isRunning()) {
                        LOGGER.info("Flow {} finished as {}, status already changed to {}", id, outcome.getValue(),
                                stored.getStatus().getValue());
                        return Uni.createFrom().item(stored);
                    }
                    Flow flow = stored.copy();
                    flow.setStatus(ticket.priorStatus());
                    flow.setUpdatedAt(clock.instant());
                    return repository.save(flow)
                            .invoke(saved -> LOGGER.info("Flow '{}' ({}) finished as {}", saved.getName(), id,
                                    outcome.getValue()));
                });
    }

    public boolean hasActiveRun(UUID id) {
        return activeRuns.containsKey(id);
    }

    public Uni<List<Occurrence>> upcoming(UUID id, Instant from, Instant to) {
        return repository.findById(id)
                .map(flow -> {
                    if (!flow.isScheduled()) {
                        return List.<Occurrence>of();
                    }
                    try {
                        return recurrenceEngine.expand(flow.getSchedule(), from, to);
                    } catch (InvalidScheduleException e) {
                        throw new FlowValidationException(e.getErrors());
                    }
                });
    }

    public Uni<List<FlowExecution>> executions(UUID id, int limit) {
        return repository.findById(id)
                .chain(flow -> executionRepository.findByFlow(id, limit));
    }

    /**
     * Conflict report for a draft without saving anything. {@code excludeId} is the flow being edited.
     */
    public Uni<List<ConflictingFlow>> checkConflicts(FlowDraftDTO draft, UUID excludeId) {
        Flow flow = new Flow();
        flow.setId(excludeId);
        flow.setName(draft.getName());
        flow.setTriggerType(draft.getTriggerType());
        flow.setSchedule(draft.getSchedule());
        if (draft.getSchedule() == null) {
            return Uni.createFrom().item(List.of());
        }
        return findConflicts(flow);
    }

    public Uni<List<FlowAction>> parseDescription(String text) {
        if (text == null || text.isBlank()) {
            return Uni.createFrom().failure(new FlowValidationException("Description text is required"));
        }
        if (descriptionParsers == null || !descriptionParsers.isResolvable()) {
            return Uni.createFrom().failure(new FlowValidationException("Natural-language parsing is not available"));
        }
        return descriptionParsers.get().parseDescription(text)
                .map(actions -> {
                    if (actions == null || actions.isEmpty()) {
                        throw new FlowValidationException("Description did not produce any action");
                    }
                    if (actions.contains(null)) {
                        throw new FlowValidationException("Parser produced a malformed action");
                    }
                    return List.copyOf(actions);
                });
    }

    public PlanningHorizon planningHorizon() {
        return PlanningHorizon.ofDays(clock.instant(), config.getPlanningHorizonDays());
    }

    private Uni<List<ConflictingFlow>> findConflicts(Flow flow) {
        if (!flow.isScheduled() || !flow.getStatus().takesPartInConflictCheck()) {
            return Uni.createFrom().item(List.of());
        }
        PlanningHorizon horizon = planningHorizon();
        return repository.findActiveScheduled()
                .map(existing -> overlapDetector.findConflicts(FlowCandidate.of(flow), existing, horizon));
    }

    private Uni<Flow> mutable(UUID id, String operation) {
        return repository.findById(id)
                .chain(flow -> {
                    if (flow.isRunning() || activeRuns.containsKey(id)) {
                        return Uni.createFrom().failure(new InvalidFlowStateException(id, FlowStatus.RUNNING, operation));
                    }
                    return Uni.createFrom().item(flow);
                });
    }

    private Uni<Flow> mutateActions(UUID id, String operation, Consumer<List<FlowAction>> change) {
        return mutable(id, operation)
                .chain(stored -> {
                    Flow flow = stored.copy();
                    List<FlowAction> actions = new ArrayList<>(flow.getActions());
                    change.accept(actions);
                    if (actions.isEmpty()) {
                        return Uni.createFrom().failure(new FlowValidationException(FlowValidator.EMPTY_ACTIONS));
                    }
                    flow.setActions(actions);
                    return persist(flow, ExecutionMode.LIVE, "Changed actions of");
                });
    }

    private Uni<Flow> persist(Flow flow, ExecutionMode mode, String verb) {
        flow.setUpdatedAt(clock.instant());
        if (mode.isDryRun()) {
            return Uni.createFrom().item(flow);
        }
        return repository.save(flow)
                .invoke(saved -> {
                    triggerRegistry.sync(saved);
                    LOGGER.info("{} flow '{}' ({}), status {}", verb, saved.getName(), saved.getId(),
                            saved.getStatus().getValue());
                });
    }

    private static void applyPatch(Flow flow, FlowPatchDTO patch) {
        if (patch.getName() != null) {
            flow.setName(patch.getName());
        }
        if (patch.getNameHe() != null) {
            flow.setNameHe(patch.getNameHe());
        }
        if (patch.getDescription() != null) {
            flow.setDescription(patch.getDescription());
        }
        if (patch.getDescriptionHe() != null) {
            flow.setDescriptionHe(patch.getDescriptionHe());
        }
        if (patch.getActions() != null) {
            flow.setActions(new ArrayList<>(patch.getActions()));
        }
        if (patch.getTriggerType() != null) {
            flow.setTriggerType(patch.getTriggerType());
            if (patch.getTriggerType() != TriggerType.SCHEDULED && patch.getSchedule() == null) {
                flow.setSchedule(null);
            }
        }
        if (patch.getSchedule() != null) {
            flow.setSchedule(patch.getSchedule().copy());
        }
        if (patch.getPriority() != null) {
            flow.setPriority(patch.getPriority());
        }
        if (patch.getLoop() != null) {
            flow.setLoop(patch.getLoop());
        }
    }

    private static void checkIndex(int index, int size) {
        if (index < 0 || index >= size) {
            throw new FlowValidationException(String.format("Action index %d is outside 0..%d", index, size - 1));
        }
    }
}
