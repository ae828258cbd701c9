package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record Announcement(String text, String voice, String ttsLanguage, Double exaggeration,
                           String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.ANNOUNCEMENT;
    }

    // ~10 seconds per 100 characters
    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        int length = text == null ? 0 : text.length();
        long estimate = Math.round(length / 100.0 * 10);
        return FlowAction.seconds(Math.max(defaults.announcementMinSeconds(), estimate));
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (text == null || text.isBlank()) {
            errors.add("Announcement text is required");
        }
        if (exaggeration != null && (exaggeration < 0 || exaggeration > 2)) {
            errors.add("Exaggeration must be between 0 and 2");
        }
        return errors;
    }
}
