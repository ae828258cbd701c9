package io.kneo.autoflow.service.scheduler;

import io.kneo.autoflow.model.scheduler.TimeRange;

import java.util.List;
import java.util.UUID;

public record ConflictingFlow(UUID flowId, String name, int priority, ConflictReason reason,
                              List<TimeRange> overlaps) {
}
