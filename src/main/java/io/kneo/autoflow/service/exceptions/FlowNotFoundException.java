package io.kneo.autoflow.service.exceptions;

import lombok.Getter;

import java.util.UUID;

@Getter
public class FlowNotFoundException extends RuntimeException {
    private final UUID flowId;

    public FlowNotFoundException(UUID flowId) {
        super("Flow not found: " + flowId);
        this.flowId = flowId;
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
