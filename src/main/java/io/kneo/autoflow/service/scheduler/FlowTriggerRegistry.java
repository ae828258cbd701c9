package io.kneo.autoflow.service.scheduler;

import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.scheduler.Occurrence;
import io.kneo.autoflow.model.scheduler.Schedule;
import io.kneo.autoflow.repository.FlowRepository;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Timer registrations of scheduled flows. Only registered flows are fired by the trigger ticker;
 * pausing, disabling or deleting a flow removes its registration.
 */
@ApplicationScoped
public class FlowTriggerRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowTriggerRegistry.class);

    private final Map<UUID, Registration> registrations = new ConcurrentHashMap<>();
    private final RecurrenceEngine recurrenceEngine;
    private final FlowRepository repository;

    public record Registration(UUID flowId, String name, int priority, Schedule schedule) {
    }

    public record Due(Registration registration, Occurrence occurrence) {
    }

    @Inject
    public FlowTriggerRegistry(RecurrenceEngine recurrenceEngine, FlowRepository repository) {
        this.recurrenceEngine = recurrenceEngine;
        this.repository = repository;
    }

    void onStart(@Observes StartupEvent event) {
        repository.findActiveScheduled()
                .subscribe().with(
                        flows -> {
                            flows.forEach(this::sync);
                            LOGGER.info("Registered {} scheduled flows", registrations.size());
                        },
                        failure -> LOGGER.error("Failed to load scheduled flows", failure)
                );
    }

    /**
     * Registers the flow when it is an active scheduled flow, otherwise removes any registration.
     */
    public void sync(Flow flow) {
        boolean eligible = flow.isScheduled()
                && (flow.getStatus() == FlowStatus.ACTIVE || flow.getStatus() == FlowStatus.RUNNING);
        if (eligible) {
            registrations.put(flow.getId(),
                    new Registration(flow.getId(), flow.getName(), flow.getPriority(), flow.getSchedule().copy()));
        } else if (registrations.remove(flow.getId()) != null) {
            LOGGER.info("Removed trigger registration for flow {} ({})", flow.getId(), flow.getStatus().getValue());
        }
    }

    public void unregister(UUID flowId) {
        if (registrations.remove(flowId) != null) {
            LOGGER.info("Removed trigger registration for flow {}", flowId);
        }
    }

    public boolean isRegistered(UUID flowId) {
        return registrations.containsKey(flowId);
    }

    public Collection<Registration> getRegistrations() {
        return new ArrayList<>(registrations.values());
    }

    /**
     * Registrations with an occurrence starting in {@code [from, to)}, earliest first and,
     * for the same instant, highest priority first.
     */
    public List<Due> dueBetween(Instant from, Instant to) {
        List<Due> due = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            try {
                recurrenceEngine.expand(registration.schedule(), from, to).stream()
                        .filter(occurrence -> !occurrence.start().isBefore(from) && occurrence.start().isBefore(to))
                        .findFirst()
                        .ifPresent(occurrence -> due.add(new Due(registration, occurrence)));
            } catch (InvalidScheduleException e) {
                LOGGER.warn("Registered flow {} has a malformed schedule: {}", registration.flowId(), e.getMessage());
            }
        }
        due.sort(Comparator.comparing((Due d) -> d.occurrence().start())
                .thenComparing(d -> d.registration().priority(), Comparator.reverseOrder()));
        return due;
    }

    public Optional<Registration> get(UUID flowId) {
        return Optional.ofNullable(registrations.get(flowId));
    }
}
