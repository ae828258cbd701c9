package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.List;

public record Wait(Integer durationMinutes, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.WAIT;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return durationMinutes == null ? Duration.ZERO : FlowAction.seconds(durationMinutes * 60L);
    }

    @Override
    public List<String> validate() {
        return durationMinutes == null || durationMinutes < 1 ? List.of("Wait duration is required") : List.of();
    }
}
