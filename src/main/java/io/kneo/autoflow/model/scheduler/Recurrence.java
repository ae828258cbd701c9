package io.kneo.autoflow.model.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Recurrence {
    NONE("none"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String value;

    Recurrence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isRecurring() {
        return this != NONE;
    }

    @JsonCreator
    public static Recurrence fromValue(String value) {
        if (value == null) {
            return NONE;
        }
        for (Recurrence recurrence : values()) {
            if (recurrence.value.equalsIgnoreCase(value) || recurrence.name().equalsIgnoreCase(value)) {
                return recurrence;
            }
        }
        throw new IllegalArgumentException("Unknown recurrence: " + value);
    }
}
