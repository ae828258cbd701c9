package io.kneo.autoflow.repository;

import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.service.exceptions.FlowNotFoundException;
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
public class InMemoryFlowRepository implements FlowRepository {
    private final Map<UUID, Flow> flows = new ConcurrentHashMap<>();

    @Override
    public Uni<Flow> findById(UUID id) {
        Flow flow = flows.get(id);
        if (flow == null) {
            return Uni.createFrom().failure(new FlowNotFoundException(id));
        }
        return Uni.createFrom().item(flow.copy());
    }

    @Override
    public Uni<List<Flow>> getAll() {
        return Uni.createFrom().item(() -> flows.values().stream()
                .sorted(Comparator.comparing(Flow::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(Flow::copy)
                .toList());
    }

    @Override
    public Uni<List<Flow>> findActiveScheduled() {
        return Uni.createFrom().item(() -> flows.values().stream()
                .filter(flow -> flow.getTriggerType() == TriggerType.SCHEDULED)
                .filter(flow -> flow.getStatus() != null && flow.getStatus().takesPartInConflictCheck())
                .map(Flow::copy)
                .toList());
    }

    @Override
    public Uni<Flow> save(Flow flow) {
        if (flow.getId() == null) {
            flow.setId(UUID.randomUUID());
        }
        Flow stored = flow.copy();
        flows.put(stored.getId(), stored);
        return Uni.createFrom().item(stored.copy());
    }

    @Override
    public Uni<Integer> delete(UUID id) {
        return Uni.createFrom().item(() -> flows.remove(id) != null ? 1 : 0);
    }
}
