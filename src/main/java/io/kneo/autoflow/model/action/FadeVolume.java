package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record FadeVolume(Integer target, Integer durationSeconds, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.FADE_VOLUME;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return durationSeconds == null ? Duration.ZERO : FlowAction.seconds(durationSeconds);
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (target == null || target < 0 || target > 100) {
            errors.add("Target volume must be between 0 and 100");
        }
        if (durationSeconds == null || durationSeconds < 0) {
            errors.add("Fade duration must not be negative");
        }
        return errors;
    }
}
