package io.kneo.autoflow.repository;

import io.kneo.autoflow.model.Flow;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

/**
 * Flow store. Assumed strongly consistent for overlap checks; two concurrent creators can
 * still both pass a check before either saves.
 */
public interface FlowRepository {

    /**
     * Fails with {@link io.kneo.autoflow.service.exceptions.FlowNotFoundException} when absent.
     */
    Uni<Flow> findById(UUID id);

    Uni<List<Flow>> getAll();

    /**
     * Scheduled flows whose status is active or running.
     */
    Uni<List<Flow>> findActiveScheduled();

    Uni<Flow> save(Flow flow);

    Uni<Integer> delete(UUID id);
}
