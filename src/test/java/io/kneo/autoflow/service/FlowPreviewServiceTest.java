package io.kneo.autoflow.service;

import io.kneo.autoflow.config.MutableClock;
import io.kneo.autoflow.config.TestAutoFlowConfig;
import io.kneo.autoflow.dto.TimelineDTO;
import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.action.PlayContent;
import io.kneo.autoflow.model.action.PlayJingle;
import io.kneo.autoflow.model.action.Wait;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.repository.InMemoryFlowExecutionRepository;
import io.kneo.autoflow.repository.InMemoryFlowRepository;
import io.kneo.autoflow.service.execution.FlowStepper;
import io.kneo.autoflow.service.execution.FlowTimelines;
import io.kneo.autoflow.service.execution.ManualTickScheduler;
import io.kneo.autoflow.service.execution.StepListener;
import io.kneo.autoflow.service.execution.StepperState;
import io.kneo.autoflow.service.execution.TimeScale;
import io.kneo.autoflow.service.execution.TimelineSegment;
import io.kneo.autoflow.service.external.ContentLookup;
import io.kneo.autoflow.service.scheduler.FlowTriggerRegistry;
import io.kneo.autoflow.service.scheduler.OverlapDetector;
import io.kneo.autoflow.service.scheduler.RecurrenceEngine;
import io.kneo.autoflow.service.scheduler.ScheduleValidator;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FlowPreviewServiceTest {
    private InMemoryFlowRepository repository;
    private ContentLookup contentLookup;
    private ManualTickScheduler scheduler;
    private FlowPreviewService previewService;

    @BeforeEach
    void setUp() {
        TestAutoFlowConfig config = new TestAutoFlowConfig();
        ScheduleValidator scheduleValidator = new ScheduleValidator();
        RecurrenceEngine engine = new RecurrenceEngine(config, scheduleValidator);
        MutableClock clock = new MutableClock(Instant.parse("2024-01-08T09:00:00Z"));
        repository = new InMemoryFlowRepository();
        FlowService flowService = new FlowService(repository, new InMemoryFlowExecutionRepository(), engine,
                new OverlapDetector(engine), new FlowValidator(scheduleValidator),
                new FlowTriggerRegistry(engine, repository), config, clock);
        contentLookup = mock(ContentLookup.class);
        scheduler = new ManualTickScheduler();
        previewService = new FlowPreviewService(flowService, new FlowTimelines(engine, config), contentLookup,
                scheduler, clock, config);
    }

    @Test
    void testTimeline_TitlesFallBackToRawId() {
        when(contentLookup.resolveContentTitle("news-0800")).thenReturn(Uni.createFrom().item(Optional.of("Morning news")));
        when(contentLookup.resolveContentTitle("station-id"))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("catalogue offline")));
        Flow flow = store();

        TimelineDTO timeline = previewService.timeline(flow.getId()).await().indefinitely();

        assertEquals(List.of("Morning news", "station-id", "Silence"),
                timeline.segments().stream().map(TimelineDTO.SegmentDTO::title).toList());
        assertEquals(List.of(0L, 180L, 195L),
                timeline.segments().stream().map(TimelineDTO.SegmentDTO::startSeconds).toList());
        assertEquals(495, timeline.sequenceSeconds());
        assertFalse(timeline.looping());
    }

    @Test
    void testPreview_RunsFasterAndLeavesFlowUntouched() {
        Flow flow = store();
        List<Integer> started = new ArrayList<>();
        StepListener listener = new StepListener() {
            @Override
            public void onActionStarted(FlowStepper stepper, TimelineSegment segment, int cycle) {
                started.add(segment.index());
            }
        };

        FlowStepper stepper = previewService.preview(flow.getId(), listener).await().indefinitely();
        stepper.play();
        scheduler.advance(Duration.ofSeconds(3));
        assertEquals(List.of(0, 1), started);

        stepper.step();
        assertEquals(List.of(0, 1, 2), started);
        scheduler.advance(Duration.ofSeconds(5));

        assertEquals(StepperState.FINISHED, stepper.getState());
        Flow stored = repository.findById(flow.getId()).await().indefinitely();
        assertEquals(0, stored.getRunCount());
        assertEquals(flow.getStatus(), stored.getStatus());
    }

    @Test
    void testPreview_CustomScale() {
        Flow flow = store();

        FlowStepper stepper = previewService.preview(flow, scheduler, TimeScale.realTime(), new StepListener() {
        });
        stepper.play();
        scheduler.advance(Duration.ofSeconds(180));

        assertEquals(1, stepper.getCurrentStep());
        assertEquals("preview:Newsroom", stepper.getName());
    }

    private Flow store() {
        Flow flow = new Flow();
        flow.setName("Newsroom");
        flow.setTriggerType(TriggerType.MANUAL);
        flow.setActions(List.of(
                new PlayContent("news-0800", null),
                new PlayJingle("station-id", null),
                new Wait(5, "Silence")));
        return repository.save(flow).await().indefinitely();
    }
}
