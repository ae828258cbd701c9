package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.List;

public record PlayContent(String contentId, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.PLAY_CONTENT;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return isValid() ? FlowAction.seconds(defaults.contentSeconds()) : Duration.ZERO;
    }

    @Override
    public List<String> validate() {
        return contentId == null || contentId.isBlank() ? List.of("Content selection is required") : List.of();
    }
}
