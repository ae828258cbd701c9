package io.kneo.autoflow.service;

import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.cnst.ExecutionMode;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.cnst.RunTrigger;

import java.time.Instant;

/**
 * Proof that a run was admitted. {@code flow} is the snapshot the run executes.
 */
public record RunTicket(Flow flow, FlowStatus priorStatus, Instant startedAt, RunTrigger triggeredBy,
                        ExecutionMode mode) {
}
