package io.kneo.autoflow.model.cnst;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunTrigger {
    SCHEDULE("schedule"),
    MANUAL("manual"),
    EVENT("event"),
    CHAT("chat");

    private final String value;

    RunTrigger(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
