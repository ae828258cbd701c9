package io.kneo.autoflow.model.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record PlayGenre(String genre, Integer durationMinutes, Integer songCount, String description) implements FlowAction {

    @Override
    public ActionType type() {
        return ActionType.PLAY_GENRE;
    }

    @Override
    public Duration estimateDuration(ActionDurationDefaults defaults) {
        if (durationMinutes != null && durationMinutes > 0) {
            return FlowAction.seconds(durationMinutes * 60L);
        }
        if (songCount != null && songCount > 0) {
            return FlowAction.seconds(songCount * defaults.secondsPerSong());
        }
        return Duration.ZERO;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (genre == null || genre.isBlank()) {
            errors.add("Genre is required");
        }
        boolean hasDuration = durationMinutes != null && durationMinutes > 0;
        boolean hasSongs = songCount != null && songCount > 0;
        if (!hasDuration && !hasSongs) {
            errors.add("Duration or song count is required");
        }
        return errors;
    }
}
