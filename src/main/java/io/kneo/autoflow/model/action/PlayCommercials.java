package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Plays {@code count} commercials, optionally limited to one named batch.
 */
public record PlayCommercials(Integer count, String batch, String description) implements FlowAction {
    public static final int MAX_COUNT = 10;

    @Override
    public ActionType type() {
        return ActionType.PLAY_COMMERCIALS;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        int effective = count == null ? 0 : Math.min(count, MAX_COUNT);
        return FlowAction.seconds(effective * defaults.secondsPerCommercial());
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (count == null || count < 1) {
            errors.add("At least 1 commercial is required");
        } else if (count > MAX_COUNT) {
            errors.add("No more than " + MAX_COUNT + " commercials per action");
        }
        if (batch != null && batch.isBlank()) {
            errors.add("Batch must not be blank when given");
        }
        return errors;
    }
}
