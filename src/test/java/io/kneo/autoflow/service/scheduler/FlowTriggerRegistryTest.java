package io.kneo.autoflow.service.scheduler;

import io.kneo.autoflow.config.TestAutoFlowConfig;
import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.repository.InMemoryFlowRepository;
import io.quarkus.runtime.StartupEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static io.kneo.autoflow.service.scheduler.OverlapDetectorTest.flow;
import static io.kneo.autoflow.service.scheduler.RecurrenceEngineTest.weekly;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowTriggerRegistryTest {
    private InMemoryFlowRepository repository;
    private FlowTriggerRegistry registry;

    @BeforeEach
    void setUp() {
        repository = new InMemoryFlowRepository();
        registry = new FlowTriggerRegistry(new RecurrenceEngine(new TestAutoFlowConfig(), new ScheduleValidator()),
                repository);
    }

    @Test
    void testSync_OnlyActiveScheduledFlowsRegistered() {
        Flow active = flow("Morning", weekly(Set.of(1), LocalTime.of(8, 0), LocalTime.of(10, 0)));
        Flow paused = flow("Paused", weekly(Set.of(1), LocalTime.of(8, 0), LocalTime.of(10, 0)));
        paused.setStatus(FlowStatus.PAUSED);
        Flow manual = flow("Manual", null);
        manual.setTriggerType(TriggerType.MANUAL);

        registry.sync(active);
        registry.sync(paused);
        registry.sync(manual);

        assertTrue(registry.isRegistered(active.getId()));
        assertFalse(registry.isRegistered(paused.getId()));
        assertFalse(registry.isRegistered(manual.getId()));

        active.setStatus(FlowStatus.DISABLED);
        registry.sync(active);
        assertTrue(registry.getRegistrations().isEmpty());
    }

    @Test
    void testDueBetween_HalfOpenWindowAndPriorityOrder() {
        Flow low = flow("Low", weekly(Set.of(1), LocalTime.of(8, 0), LocalTime.of(9, 0)));
        Flow high = flow("High", weekly(Set.of(1), LocalTime.of(8, 0), LocalTime.of(9, 0)));
        high.setPriority(10);
        Flow later = flow("Later", weekly(Set.of(1), LocalTime.of(8, 0, 30), LocalTime.of(9, 0)));
        registry.sync(low);
        registry.sync(high);
        registry.sync(later);

        List<FlowTriggerRegistry.Due> due = registry.dueBetween(
                Instant.parse("2024-01-08T08:00:00Z"), Instant.parse("2024-01-08T08:00:30Z"));

        assertEquals(List.of(high.getId(), low.getId()),
                due.stream().map(d -> d.registration().flowId()).toList());
        assertEquals(Instant.parse("2024-01-08T08:00:00Z"), due.get(0).occurrence().start());

        // a window already in progress is not due again
        assertTrue(registry.dueBetween(
                Instant.parse("2024-01-08T08:01:00Z"), Instant.parse("2024-01-08T08:30:00Z")).isEmpty());
    }

    @Test
    void testOnStart_LoadsStoredFlows() {
        Flow stored = flow("Morning", weekly(Set.of(1), LocalTime.of(8, 0), LocalTime.of(10, 0)));
        repository.save(stored).await().indefinitely();
        Flow paused = flow("Paused", weekly(Set.of(2), LocalTime.of(8, 0), LocalTime.of(10, 0)));
        paused.setStatus(FlowStatus.PAUSED);
        repository.save(paused).await().indefinitely();

        registry.onStart(new StartupEvent());

        assertEquals(1, registry.getRegistrations().size());
        assertEquals("Morning", registry.get(stored.getId()).orElseThrow().name());
    }
}
