package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public record TimeCheck(String format, String language, String description) implements FlowAction {
    private static final Set<String> FORMATS = Set.of("12h", "24h");

    @Override
    public ActionType type() {
        return ActionType.TIME_CHECK;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return FlowAction.seconds(defaults.timeCheckSeconds());
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (format == null || !FORMATS.contains(format)) {
            errors.add("Time format must be 12h or 24h");
        }
        if (language == null || language.isBlank()) {
            errors.add("Time check language is required");
        }
        return errors;
    }
}
