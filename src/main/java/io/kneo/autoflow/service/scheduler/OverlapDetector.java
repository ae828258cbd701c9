package io.kneo.autoflow.service.scheduler;

import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.model.scheduler.Occurrence;
import io.kneo.autoflow.model.scheduler.PlanningHorizon;
import io.kneo.autoflow.model.scheduler.TimeRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Finds scheduled flows whose occurrences intersect a candidate's. Intervals are half-open,
 * so a flow ending at 10:00 and one starting at 10:00 do not conflict. A flow whose schedule
 * cannot be expanded is reported as conflicting over the whole horizon.
 */
@ApplicationScoped
public class OverlapDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(OverlapDetector.class);

    private final RecurrenceEngine recurrenceEngine;

    @Inject
    public OverlapDetector(RecurrenceEngine recurrenceEngine) {
        this.recurrenceEngine = recurrenceEngine;
    }

    public List<ConflictingFlow> findConflicts(FlowCandidate candidate, Collection<Flow> existing, PlanningHorizon horizon) {
        if (!candidate.isScheduled()) {
            return List.of();
        }
        List<Occurrence> candidateOccurrences;
        try {
            candidateOccurrences = recurrenceEngine.expand(candidate.schedule(), horizon);
        } catch (InvalidScheduleException e) {
            LOGGER.warn("Candidate '{}' has a malformed schedule, every scheduled flow counts as conflicting: {}",
                    candidate.name(), e.getMessage());
            return participants(existing, candidate.id()).stream()
                    .map(flow -> wholeHorizon(flow, horizon))
                    .toList();
        }
        return findConflicts(candidateOccurrences, candidate.id(), existing, horizon);
    }

    /**
     * @param candidateOccurrences sorted by start
     * @param excludeId            the flow being edited, never compared with itself
     */
    public List<ConflictingFlow> findConflicts(List<Occurrence> candidateOccurrences, UUID excludeId,
                                               Collection<Flow> existing, PlanningHorizon horizon) {
        List<ConflictingFlow> conflicts = new ArrayList<>();
        for (Flow flow : participants(existing, excludeId)) {
            List<Occurrence> occurrences;
            try {
                if (flow.getSchedule() == null) {
                    throw new InvalidScheduleException(List.of("Scheduled flow has no schedule"));
                }
                occurrences = recurrenceEngine.expand(flow.getSchedule(), horizon);
            } catch (InvalidScheduleException e) {
                LOGGER.warn("Flow {} ({}) has a malformed schedule, treated as conflicting: {}",
                        flow.getId(), flow.getName(), e.getMessage());
                conflicts.add(wholeHorizon(flow, horizon));
                continue;
            }
            List<TimeRange> overlaps = overlaps(candidateOccurrences, occurrences);
            if (!overlaps.isEmpty()) {
                conflicts.add(new ConflictingFlow(flow.getId(), flow.getName(), flow.getPriority(),
                        ConflictReason.OVERLAP, overlaps));
            }
        }
        return conflicts;
    }

    /**
     * Merge sweep over two start-sorted lists of disjoint occurrences.
     */
    static List<TimeRange> overlaps(List<Occurrence> a, List<Occurrence> b) {
        List<TimeRange> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < a.size() && j < b.size()) {
            Occurrence left = a.get(i);
            Occurrence right = b.get(j);
            if (left.start().isBefore(right.end()) && right.start().isBefore(left.end())) {
                result.add(TimeRange.intersection(left, right));
            }
            if (left.end().isBefore(right.end())) {
                i++;
            } else {
                j++;
            }
        }
        return result;
    }

    private List<Flow> participants(Collection<Flow> existing, UUID excludeId) {
        return existing.stream()
                .filter(flow -> flow.getTriggerType() == TriggerType.SCHEDULED)
                .filter(flow -> flow.getStatus() != null && flow.getStatus().takesPartInConflictCheck())
                .filter(flow -> excludeId == null || !Objects.equals(flow.getId(), excludeId))
                .toList();
    }

    private ConflictingFlow wholeHorizon(Flow flow, PlanningHorizon horizon) {
        return new ConflictingFlow(flow.getId(), flow.getName(), flow.getPriority(), ConflictReason.INVALID_SCHEDULE,
                List.of(new TimeRange(horizon.from(), horizon.to())));
    }
}
