package io.kneo.autoflow.service;

import io.kneo.autoflow.config.MutableClock;
import io.kneo.autoflow.config.TestAutoFlowConfig;
import io.kneo.autoflow.dto.FlowDraftDTO;
import io.kneo.autoflow.dto.FlowPatchDTO;
import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.action.PlayCommercials;
import io.kneo.autoflow.model.action.PlayGenre;
import io.kneo.autoflow.model.action.Wait;
import io.kneo.autoflow.model.cnst.ExecutionMode;
import io.kneo.autoflow.model.cnst.ExecutionStatus;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.cnst.RunTrigger;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.model.scheduler.Occurrence;
import io.kneo.autoflow.model.scheduler.Recurrence;
import io.kneo.autoflow.model.scheduler.Schedule;
import io.kneo.autoflow.repository.InMemoryFlowExecutionRepository;
import io.kneo.autoflow.repository.InMemoryFlowRepository;
import io.kneo.autoflow.service.exceptions.FlowConflictException;
import io.kneo.autoflow.service.exceptions.FlowNotFoundException;
import io.kneo.autoflow.service.exceptions.FlowValidationException;
import io.kneo.autoflow.service.exceptions.InvalidFlowStateException;
import io.kneo.autoflow.service.scheduler.FlowTriggerRegistry;
import io.kneo.autoflow.service.scheduler.OverlapDetector;
import io.kneo.autoflow.service.scheduler.RecurrenceEngine;
import io.kneo.autoflow.service.scheduler.ScheduleValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowServiceTest {
    // a Sunday
    static final Instant NOW = Instant.parse("2024-01-07T06:00:00Z");

    private InMemoryFlowRepository repository;
    private FlowTriggerRegistry registry;
    private FlowService service;

    @BeforeEach
    void setUp() {
        TestAutoFlowConfig config = new TestAutoFlowConfig();
        ScheduleValidator scheduleValidator = new ScheduleValidator();
        RecurrenceEngine engine = new RecurrenceEngine(config, scheduleValidator);
        repository = new InMemoryFlowRepository();
        registry = new FlowTriggerRegistry(engine, repository);
        service = new FlowService(repository, new InMemoryFlowExecutionRepository(), engine,
                new OverlapDetector(engine), new FlowValidator(scheduleValidator), registry, config,
                new MutableClock(NOW));
    }

    @Test
    void testCreate_MorningShowThenConflictingCopy() {
        Flow first = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();

        assertNotNull(first.getId());
        assertEquals(FlowStatus.ACTIVE, first.getStatus());
        assertEquals(NOW, first.getCreatedAt());
        assertTrue(registry.isRegistered(first.getId()));

        FlowConflictException conflict = assertThrows(FlowConflictException.class,
                () -> service.create(morningShow("Copy"), false, ExecutionMode.LIVE).await().indefinitely());
        assertEquals(1, conflict.getConflicts().size());
        assertEquals(first.getId(), conflict.getConflicts().get(0).flowId());
        assertEquals(1, service.list().await().indefinitely().size(), "Rejected flow must not be saved");
    }

    @Test
    void testCreate_ZeroActionsAlwaysRejected() {
        FlowDraftDTO draft = morningShow("Empty");
        draft.setActions(new ArrayList<>());

        FlowValidationException e = assertThrows(FlowValidationException.class,
                () -> service.create(draft, true, ExecutionMode.LIVE).await().indefinitely());
        assertEquals(List.of(FlowValidator.EMPTY_ACTIONS), e.getErrors());
    }

    @Test
    void testCreate_CollectsActionAndScheduleErrors() {
        FlowDraftDTO draft = morningShow("Broken");
        draft.getActions().set(1, new PlayCommercials(11, null, null));
        draft.getSchedule().setDaysOfWeek(Set.of());

        FlowValidationException e = assertThrows(FlowValidationException.class,
                () -> service.create(draft, false, ExecutionMode.LIVE).await().indefinitely());
        assertTrue(e.getErrors().get(0).startsWith("Action 2 (play_commercials)"));
        assertTrue(e.getErrors().stream().anyMatch(error -> error.startsWith("Schedule:")));
    }

    @Test
    void testCreate_AnyIntegerPriorityAccepted() {
        FlowDraftDTO draft = morningShow("Background bed");
        draft.setPriority(-3);

        Flow flow = service.create(draft, false, ExecutionMode.LIVE).await().indefinitely();

        assertEquals(-3, flow.getPriority());
    }

    @Test
    void testCreate_ForceSavesConflictingFlowDisabled() {
        service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();

        Flow forced = service.create(morningShow("Forced"), true, ExecutionMode.LIVE).await().indefinitely();

        assertEquals(FlowStatus.DISABLED, forced.getStatus());
        assertFalse(registry.isRegistered(forced.getId()));
    }

    @Test
    void testCreate_DryRunPersistsNothing() {
        Flow preview = service.create(morningShow("Morning show"), false, ExecutionMode.DRY_RUN).await().indefinitely();

        assertEquals("Morning show", preview.getName());
        assertTrue(service.list().await().indefinitely().isEmpty());
    }

    @Test
    void testUpdate_OwnOccurrencesDoNotConflict() {
        Flow flow = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();
        FlowPatchDTO patch = new FlowPatchDTO();
        patch.setName("Morning show v2");
        patch.setPriority(5);

        Flow updated = service.update(flow.getId(), patch, false, ExecutionMode.LIVE).await().indefinitely();

        assertEquals("Morning show v2", updated.getName());
        assertEquals(5, updated.getPriority());
        assertEquals(3, updated.getActions().size());
    }

    @Test
    void testUpdate_UnknownFlow() {
        assertThrows(FlowNotFoundException.class, () -> service.update(UUID.randomUUID(), new FlowPatchDTO(), false,
                ExecutionMode.LIVE).await().indefinitely());
    }

    @Test
    void testToggle_PauseAndResume() {
        Flow flow = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();

        Flow paused = service.toggle(flow.getId()).await().indefinitely();
        assertEquals(FlowStatus.PAUSED, paused.getStatus());
        assertFalse(registry.isRegistered(flow.getId()));

        Flow resumed = service.toggle(flow.getId()).await().indefinitely();
        assertEquals(FlowStatus.ACTIVE, resumed.getStatus());
        assertTrue(registry.isRegistered(flow.getId()));
    }

    @Test
    void testToggle_ResumeIntoConflictRejected() {
        Flow first = service.create(morningShow("First"), false, ExecutionMode.LIVE).await().indefinitely();
        service.toggle(first.getId()).await().indefinitely();
        service.create(morningShow("Second"), false, ExecutionMode.LIVE).await().indefinitely();

        assertThrows(FlowConflictException.class, () -> service.toggle(first.getId()).await().indefinitely());
        assertEquals(FlowStatus.PAUSED, service.get(first.getId()).await().indefinitely().getStatus());
    }

    @Test
    void testRecordRun_MarksRunningAndBlocksMutations() {
        Flow flow = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();
        Instant at = NOW.plusSeconds(7200);

        RunTicket ticket = service.recordRun(flow.getId(), at, RunTrigger.MANUAL, ExecutionMode.LIVE)
                .await().indefinitely();

        Flow running = service.get(flow.getId()).await().indefinitely();
        assertEquals(FlowStatus.RUNNING, running.getStatus());
        assertEquals(1, running.getRunCount());
        assertEquals(at, running.getLastRun());

        assertThrows(InvalidFlowStateException.class, () -> service.toggle(flow.getId()).await().indefinitely());
        assertThrows(InvalidFlowStateException.class,
                () -> service.removeAction(flow.getId(), 0).await().indefinitely());
        assertThrows(InvalidFlowStateException.class, () -> service.recordRun(flow.getId(), at, RunTrigger.MANUAL,
                ExecutionMode.LIVE).await().indefinitely());

        Flow completed = service.completeRun(ticket, ExecutionStatus.COMPLETED).await().indefinitely();
        assertEquals(FlowStatus.ACTIVE, completed.getStatus());
        assertEquals(1, completed.getRunCount());
    }

    @Test
    void testCompleteRun_KeepsStatusChangedMeanwhile() {
        Flow flow = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();
        RunTicket ticket = service.recordRun(flow.getId(), NOW, RunTrigger.SCHEDULE, ExecutionMode.LIVE)
                .await().indefinitely();
        Flow changed = service.get(flow.getId()).await().indefinitely();
        changed.setStatus(FlowStatus.PAUSED);
        repository.save(changed).await().indefinitely();

        Flow completed = service.completeRun(ticket, ExecutionStatus.COMPLETED).await().indefinitely();

        assertEquals(FlowStatus.PAUSED, completed.getStatus());
    }

    @Test
    void testRecordRun_DryRunLeavesFlowUntouched() {
        Flow flow = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();

        service.recordRun(flow.getId(), NOW, RunTrigger.MANUAL, ExecutionMode.DRY_RUN).await().indefinitely();

        Flow stored = service.get(flow.getId()).await().indefinitely();
        assertEquals(FlowStatus.ACTIVE, stored.getStatus());
        assertEquals(0, stored.getRunCount());
    }

    @Test
    void testResetStuck_ReturnsRunningFlowToActive() {
        Flow flow = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();
        Flow stuck = flow.copy();
        stuck.setStatus(FlowStatus.RUNNING);
        repository.save(stuck).await().indefinitely();

        Flow reset = service.resetStuck(flow.getId()).await().indefinitely();

        assertEquals(FlowStatus.ACTIVE, reset.getStatus());
    }

    @Test
    void testActionEditing_ListNeverEmpty() {
        FlowDraftDTO draft = morningShow("Single");
        draft.setActions(List.of(new Wait(5, null)));
        Flow flow = service.create(draft, false, ExecutionMode.LIVE).await().indefinitely();

        assertThrows(FlowValidationException.class, () -> service.removeAction(flow.getId(), 0).await().indefinitely());

        Flow added = service.addAction(flow.getId(), new PlayGenre("happy", 10, null, null), 0)
                .await().indefinitely();
        assertEquals(2, added.getActions().size());
        assertEquals("happy", ((PlayGenre) added.getActions().get(0)).genre());

        Flow reordered = service.reorderActions(flow.getId(), 0, 1).await().indefinitely();
        assertTrue(reordered.getActions().get(1) instanceof PlayGenre);

        Flow removed = service.removeAction(flow.getId(), 0).await().indefinitely();
        assertEquals(1, removed.getActions().size());

        assertThrows(FlowValidationException.class,
                () -> service.addAction(flow.getId(), new Wait(0, null), null).await().indefinitely());
        assertThrows(FlowValidationException.class,
                () -> service.reorderActions(flow.getId(), 0, 3).await().indefinitely());
    }

    @Test
    void testUpcoming_ExpandsScheduleForView() {
        Flow flow = service.create(morningShow("Morning show"), false, ExecutionMode.LIVE).await().indefinitely();

        List<Occurrence> upcoming = service.upcoming(flow.getId(), NOW, NOW.plusSeconds(7 * 24 * 3600))
                .await().indefinitely();

        assertEquals(5, upcoming.size());
        assertEquals(Instant.parse("2024-01-07T08:00:00Z"), upcoming.get(0).start());
    }

    @Test
    void testManualFlow_NoScheduleAndNoConflictCheck() {
        FlowDraftDTO draft = morningShow("On demand");
        draft.setTriggerType(TriggerType.MANUAL);
        draft.setSchedule(null);

        Flow flow = service.create(draft, false, ExecutionMode.LIVE).await().indefinitely();

        assertFalse(registry.isRegistered(flow.getId()));
        assertTrue(service.upcoming(flow.getId(), NOW, NOW.plusSeconds(3600)).await().indefinitely().isEmpty());
    }

    @Test
    void testParseDescription_WithoutParser() {
        assertThrows(FlowValidationException.class,
                () -> service.parseDescription("play happy music for an hour").await().indefinitely());
    }

    static FlowDraftDTO morningShow(String name) {
        FlowDraftDTO draft = new FlowDraftDTO();
        draft.setName(name);
        draft.setActions(new ArrayList<>(List.of(
                new PlayGenre("happy", 45, null, null),
                new PlayCommercials(2, null, null),
                new PlayGenre("mizrahi", 30, null, null))));
        draft.setSchedule(Schedule.builder()
                .recurrence(Recurrence.WEEKLY)
                .daysOfWeek(Set.of(0, 1, 2, 3, 4))
                .startTime(LocalTime.of(8, 0))
                .endTime(LocalTime.of(10, 0))
                .build());
        return draft;
    }
}
