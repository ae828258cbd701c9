package io.kneo.autoflow.service.scheduler.ticker;

import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.scheduler.PlanningHorizon;
import io.kneo.autoflow.repository.FlowRepository;
import io.kneo.autoflow.service.FlowService;
import io.kneo.autoflow.service.scheduler.ConflictingFlow;
import io.kneo.autoflow.service.scheduler.FlowCandidate;
import io.kneo.autoflow.service.scheduler.OverlapDetector;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Nightly sweep re-checking every active scheduled flow against the others. Reports only,
 * flows are never changed here.
 */
@ApplicationScoped
public class FlowRevalidationTicker {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowRevalidationTicker.class);

    private final FlowRepository repository;
    private final OverlapDetector overlapDetector;
    private final FlowService flowService;

    public record RevalidationReport(int checked, Map<UUID, List<ConflictingFlow>> conflicts) {

        public boolean isClean() {
            return conflicts.isEmpty();
        }
    }

    @Inject
    public FlowRevalidationTicker(FlowRepository repository, OverlapDetector overlapDetector, FlowService flowService) {
        this.repository = repository;
        this.overlapDetector = overlapDetector;
        this.flowService = flowService;
    }

    @Scheduled(cron = "${autoflow.revalidation.cron:0 30 3 * * ?}", identity = "flow-revalidation")
    void tick() {
        revalidate().subscribe().with(
                report -> {
                    if (report.isClean()) {
                        LOGGER.info("Revalidation: {} flow(s) checked, no conflicts", report.checked());
                    } else {
                        LOGGER.warn("Revalidation: {} of {} flow(s) in conflict", report.conflicts().size(), report.checked());
                    }
                },
                error -> LOGGER.error("Revalidation sweep failed", error)
        );
    }

    public Uni<RevalidationReport> revalidate() {
        PlanningHorizon horizon = flowService.planningHorizon();
        return repository.findActiveScheduled()
                .map(flows -> {
                    Map<UUID, List<ConflictingFlow>> conflicts = new LinkedHashMap<>();
                    for (Flow flow : flows) {
                        List<ConflictingFlow> found = overlapDetector.findConflicts(FlowCandidate.of(flow), flows, horizon);
                        if (!found.isEmpty()) {
                            conflicts.put(flow.getId(), found);
                            LOGGER.warn("Flow '{}' ({}) conflicts with {}", flow.getName(), flow.getId(),
                                    found.stream().map(ConflictingFlow::name).toList());
                        }
                    }
                    return new RevalidationReport(flows.size(), Map.copyOf(conflicts));
                });
    }
}
