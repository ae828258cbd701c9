package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.List;

public record PlayJingle(String jingleId, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.PLAY_JINGLE;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return isValid() ? FlowAction.seconds(defaults.jingleSeconds()) : Duration.ZERO;
    }

    @Override
    public List<String> validate() {
        return jingleId == null || jingleId.isBlank() ? List.of("Jingle selection is required") : List.of();
    }
}
