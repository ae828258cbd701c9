package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record PlayScheduledCommercials(Integer maxDurationSeconds,
                                       Integer maxCount,
                                       List<String> includeTypes,
                                       List<String> excludeTypes,
                                       String description) implements FlowAction {

    public PlayScheduledCommercials {
        includeTypes = includeTypes == null ? List.of() : List.copyOf(includeTypes);
        excludeTypes = excludeTypes == null ? List.of() : List.copyOf(excludeTypes);
    }

    @Override
    public ActionType type() {
        return ActionType.PLAY_SCHEDULED_COMMERCIALS;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        if (maxDurationSeconds != null) {
            return FlowAction.seconds(maxDurationSeconds);
        }
        if (maxCount != null) {
            return FlowAction.seconds(maxCount * defaults.secondsPerCommercial());
        }
        return FlowAction.seconds(defaults.commercialBlockSeconds());
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (maxDurationSeconds != null && maxDurationSeconds < 1) {
            errors.add("Max duration must be positive");
        }
        if (maxCount != null && maxCount < 1) {
            errors.add("Max count must be positive");
        }
        Set<String> overlap = new HashSet<>(includeTypes);
        overlap.retainAll(excludeTypes);
        if (!overlap.isEmpty()) {
            errors.add("Commercial types both included and excluded: " + overlap);
        }
        return errors;
    }
}
