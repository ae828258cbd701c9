package io.kneo.autoflow.service.execution;

import io.kneo.autoflow.model.action.FlowAction;

import java.time.Duration;

public record TimelineSegment(int index, FlowAction action, Duration start, Duration duration, boolean valid) {

    public Duration end() {
        return start.plus(duration);
    }
}
