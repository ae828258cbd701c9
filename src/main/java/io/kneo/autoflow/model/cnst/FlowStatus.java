package io.kneo.autoflow.model.cnst;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    DISABLED("disabled"),
    RUNNING("running");

    private final String value;

    FlowStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean takesPartInConflictCheck() {
        return this == ACTIVE || this == RUNNING;
    }

    @JsonCreator
    public static FlowStatus fromValue(String value) {
        for (FlowStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown flow status: " + value);
    }
}
