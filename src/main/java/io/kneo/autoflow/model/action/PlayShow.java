package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.List;

public record PlayShow(String contentId, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.PLAY_SHOW;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return isValid() ? FlowAction.seconds(defaults.contentSeconds()) : Duration.ZERO;
    }

    @Override
    public List<String> validate() {
        return contentId == null || contentId.isBlank() ? List.of("Show selection is required") : List.of();
    }
}
