package io.kneo.autoflow.service.exceptions;

import lombok.Getter;

import java.util.List;

@Getter
public class FlowValidationException extends RuntimeException {
    private final List<String> errors;

    public FlowValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public FlowValidationException(String msg) {
        this(List.of(msg));
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
