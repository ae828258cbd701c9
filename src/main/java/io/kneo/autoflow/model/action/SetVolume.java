package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.List;

public record SetVolume(Integer level, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.SET_VOLUME;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        return FlowAction.seconds(defaults.setVolumeSeconds());
    }

    @Override
    public List<String> validate() {
        return level == null || level < 0 || level > 100 ? List.of("Volume must be between 0 and 100") : List.of();
    }
}
