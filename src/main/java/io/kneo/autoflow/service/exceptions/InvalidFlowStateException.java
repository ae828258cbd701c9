package io.kneo.autoflow.service.exceptions;

import io.kneo.autoflow.model.cnst.FlowStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class InvalidFlowStateException extends RuntimeException {
    private final UUID flowId;
    private final FlowStatus status;
    private final String operation;

    public InvalidFlowStateException(UUID flowId, FlowStatus status, String operation) {
        super(String.format("Cannot %s flow %s while it is %s", operation, flowId, status.getValue()));
        this.flowId = flowId;
        this.status = status;
        this.operation = operation;
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
