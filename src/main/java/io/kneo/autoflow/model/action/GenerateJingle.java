package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record GenerateJingle(String text, String style, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.GENERATE_JINGLE;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return FlowAction.seconds(defaults.generatedJingleSeconds());
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (text == null || text.isBlank()) {
            errors.add("Jingle text is required");
        }
        if (style == null || style.isBlank()) {
            errors.add("Jingle style is required");
        }
        return errors;
    }
}
