package io.kneo.autoflow.service.external;

import io.kneo.autoflow.model.action.FlowAction;

import java.time.Instant;
import java.util.UUID;

/**
 * One-way publication of the action that just became current in a live run.
 * The playback side subscribes independently.
 *
 * @throws io.kneo.autoflow.service.exceptions.ActionDispatchException when the action cannot be delivered
 */
public interface ActionDispatchChannel {

    void emit(UUID flowId, FlowAction action, Instant occurredAt);
}
