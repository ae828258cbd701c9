package io.kneo.autoflow.service.scheduler;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidScheduleException extends RuntimeException {
    private final List<String> errors;

    public InvalidScheduleException(List<String> errors) {
        super("Malformed schedule: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
