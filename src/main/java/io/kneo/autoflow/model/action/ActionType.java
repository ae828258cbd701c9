package io.kneo.autoflow.model.action;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionType {
    PLAY_GENRE("play_genre", ActionCategory.PLAYBACK),
    PLAY_CONTENT("play_content", ActionCategory.PLAYBACK),
    PLAY_SHOW("play_show", ActionCategory.PLAYBACK),
    PLAY_COMMERCIALS("play_commercials", ActionCategory.CONTROL),
    PLAY_SCHEDULED_COMMERCIALS("play_scheduled_commercials", ActionCategory.CONTROL),
    PLAY_JINGLE("play_jingle", ActionCategory.PLAYBACK),
    WAIT("wait", ActionCategory.CONTROL),
    SET_VOLUME("set_volume", ActionCategory.AUDIO),
    FADE_VOLUME("fade_volume", ActionCategory.AUDIO),
    ANNOUNCEMENT("announcement", ActionCategory.AUDIO),
    TIME_CHECK("time_check", ActionCategory.AUDIO),
    GENERATE_JINGLE("generate_jingle", ActionCategory.AUDIO);

    private final String value;
    private final ActionCategory category;

    ActionType(String value, ActionCategory category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public ActionCategory getCategory() {
        return category;
    }

    public enum ActionCategory {
        PLAYBACK,
        CONTROL,
        AUDIO
    }
}
