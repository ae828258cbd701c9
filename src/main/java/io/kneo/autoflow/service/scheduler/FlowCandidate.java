package io.kneo.autoflow.service.scheduler;

import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.model.scheduler.Schedule;

import java.util.UUID;

/**
 * The side of a conflict check being created or edited. {@code id} is null for a new flow.
 */
public record FlowCandidate(UUID id, String name, TriggerType triggerType, Schedule schedule) {

    public static FlowCandidate of(Flow flow) {
        return new FlowCandidate(flow.getId(), flow.getName(), flow.getTriggerType(), flow.getSchedule());
    }

    public boolean isScheduled() {
        return triggerType == TriggerType.SCHEDULED;
    }
}
