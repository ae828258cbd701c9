package io.kneo.autoflow.service.external;

import io.kneo.autoflow.model.action.FlowAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Dry-run sink: dispatches are only logged.
 */
public class NoOpDispatchChannel implements ActionDispatchChannel {
    private static final Logger LOGGER = LoggerFactory.getLogger(NoOpDispatchChannel.class);

    @Override
    public void emit(UUID flowId, FlowAction action, Instant occurredAt) {
        LOGGER.debug("Dry run: {} for flow {} at {} not dispatched", action.type().getValue(), flowId, occurredAt);
    }
}
