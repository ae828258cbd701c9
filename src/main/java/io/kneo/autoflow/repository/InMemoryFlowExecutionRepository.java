package io.kneo.autoflow.repository;

import io.kneo.autoflow.model.FlowExecution;
import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@DefaultBean
@ApplicationScoped
public class InMemoryFlowExecutionRepository implements FlowExecutionRepository {
    private final Map<UUID, FlowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public Uni<FlowExecution> insert(FlowExecution execution) {
        if (execution.getId() == null) {
            execution.setId(UUID.randomUUID());
        }
        executions.put(execution.getId(), execution.copy());
        return Uni.createFrom().item(execution);
    }

    @Override
    public Uni<FlowExecution> update(FlowExecution execution) {
        executions.put(execution.getId(), execution.copy());
        return Uni.createFrom().item(execution);
    }

    @Override
    public Uni<List<FlowExecution>> findByFlow(UUID flowId, int limit) {
        return Uni.createFrom().item(() -> executions.values().stream()
                .filter(execution -> flowId.equals(execution.getFlowId()))
                .sorted(Comparator.comparing(FlowExecution::getStartedAt).reversed())
                .limit(Math.max(0, limit))
                .map(FlowExecution::copy)
                .toList());
    }
}
