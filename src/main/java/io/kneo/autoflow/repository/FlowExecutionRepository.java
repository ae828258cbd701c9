package io.kneo.autoflow.repository;

import io.kneo.autoflow.model.FlowExecution;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface FlowExecutionRepository {

    Uni<FlowExecution> insert(FlowExecution execution);

    Uni<FlowExecution> update(FlowExecution execution);

    /**
     * Most recent first.
     */
    Uni<List<FlowExecution>> findByFlow(UUID flowId, int limit);
}
