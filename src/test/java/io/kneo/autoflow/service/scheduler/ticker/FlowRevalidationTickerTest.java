package io.kneo.autoflow.service.scheduler.ticker;

import io.kneo.autoflow.config.MutableClock;
import io.kneo.autoflow.config.TestAutoFlowConfig;
import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.action.PlayGenre;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.scheduler.Recurrence;
import io.kneo.autoflow.model.scheduler.Schedule;
import io.kneo.autoflow.repository.InMemoryFlowExecutionRepository;
import io.kneo.autoflow.repository.InMemoryFlowRepository;
import io.kneo.autoflow.service.FlowService;
import io.kneo.autoflow.service.FlowValidator;
import io.kneo.autoflow.service.scheduler.FlowTriggerRegistry;
import io.kneo.autoflow.service.scheduler.OverlapDetector;
import io.kneo.autoflow.service.scheduler.RecurrenceEngine;
import io.kneo.autoflow.service.scheduler.ScheduleValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowRevalidationTickerTest {
    private InMemoryFlowRepository repository;
    private FlowRevalidationTicker ticker;

    @BeforeEach
    void setUp() {
        TestAutoFlowConfig config = new TestAutoFlowConfig();
        ScheduleValidator scheduleValidator = new ScheduleValidator();
        RecurrenceEngine engine = new RecurrenceEngine(config, scheduleValidator);
        OverlapDetector detector = new OverlapDetector(engine);
        repository = new InMemoryFlowRepository();
        FlowService flowService = new FlowService(repository, new InMemoryFlowExecutionRepository(), engine, detector,
                new FlowValidator(scheduleValidator), new FlowTriggerRegistry(engine, repository), config,
                new MutableClock(Instant.parse("2024-01-07T00:00:00Z")));
        ticker = new FlowRevalidationTicker(repository, detector, flowService);
    }

    @Test
    void testRevalidate_ReportsBothSidesOfAConflict() {
        Flow morning = store("Morning", Set.of(1, 2, 3), LocalTime.of(8, 0), LocalTime.of(10, 0));
        Flow overlapping = store("Overlapping", Set.of(3), LocalTime.of(9, 30), LocalTime.of(11, 0));
        store("Evening", Set.of(1, 2, 3), LocalTime.of(18, 0), LocalTime.of(20, 0));

        FlowRevalidationTicker.RevalidationReport report = ticker.revalidate().await().indefinitely();

        assertEquals(3, report.checked());
        assertEquals(Set.of(morning.getId(), overlapping.getId()), report.conflicts().keySet());
        assertEquals(overlapping.getId(), report.conflicts().get(morning.getId()).get(0).flowId());
    }

    @Test
    void testRevalidate_PausedFlowsIgnored() {
        store("Morning", Set.of(1), LocalTime.of(8, 0), LocalTime.of(10, 0));
        Flow paused = store("Paused copy", Set.of(1), LocalTime.of(8, 0), LocalTime.of(10, 0));
        paused.setStatus(FlowStatus.PAUSED);
        repository.save(paused).await().indefinitely();

        FlowRevalidationTicker.RevalidationReport report = ticker.revalidate().await().indefinitely();

        assertEquals(1, report.checked());
        assertTrue(report.isClean());
    }

    private Flow store(String name, Set<Integer> days, LocalTime start, LocalTime end) {
        Flow flow = new Flow();
        flow.setName(name);
        flow.setActions(List.of(new PlayGenre("happy", 30, null, null)));
        flow.setSchedule(Schedule.builder()
                .recurrence(Recurrence.WEEKLY)
                .daysOfWeek(days)
                .startTime(start)
                .endTime(end)
                .build());
        return repository.save(flow).await().indefinitely();
    }
}
