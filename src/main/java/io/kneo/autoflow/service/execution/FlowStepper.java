package io.kneo.autoflow.service.execution;

import io.smallrye.mutiny.subscription.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Walks a {@link Timeline} action by action. The same state machine drives live dispatch and
 * preview simulation; only the {@link TimeScale} and the listener differ.
 *
 * <pre>
 * IDLE -> PLAYING <-> PAUSED -> FINISHED, reset() returns to IDLE from any state
 * </pre>
 *
 * At most one auto-advance timer is pending at a time; every transition cancels it first, and
 * a timer that fires after being superseded is ignored.
 */
public class FlowStepper {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowStepper.class);

    private final String name;
    private final Timeline timeline;
    private final TickScheduler scheduler;
    private final TimeScale timeScale;
    private final StepListener listener;

    private StepperState state = StepperState.IDLE;
    private int cycle;
    private int currentStep;
    private Duration elapsed = Duration.ZERO;
    private boolean currentAnnounced;

    private Cancellable pending;
    private long generation;
    private long anchorMillis;
    private Duration elapsedAtAnchor = Duration.ZERO;

    public FlowStepper(String name, Timeline timeline, TickScheduler scheduler, TimeScale timeScale, StepListener listener) {
        this.name = name;
        this.timeline = timeline;
        this.scheduler = scheduler;
        this.timeScale = timeScale;
        this.listener = listener;
    }

    public synchronized void play() {
        if (state == StepperState.PLAYING || state == StepperState.FINISHED) {
            return;
        }
        transition(StepperState.PLAYING);
        announceCurrent();
        if (state == StepperState.PLAYING) {
            scheduleAdvance();
        }
    }

    public synchronized void pause() {
        if (state != StepperState.PLAYING) {
            return;
        }
        elapsed = liveElapsed();
        cancelPending();
        transition(StepperState.PAUSED);
    }

    /**
     * Completes the current action and moves to the next one, whatever the play state.
     * Past the final action of a single pass this is a no-op.
     */
    public synchronized void step() {
        if (state == StepperState.FINISHED) {
            return;
        }
        boolean playing = state == StepperState.PLAYING;
        cancelPending();
        elapsed = timeline.endOf(cycle, currentStep);
        if (!moveToNext()) {
            finish(true);
            return;
        }
        if (state == StepperState.IDLE) {
            transition(StepperState.PAUSED);
        }
        announceCurrent();
        if (playing && state == StepperState.PLAYING) {
            scheduleAdvance();
        }
    }

    public synchronized void reset() {
        cancelPending();
        cycle = 0;
        currentStep = 0;
        elapsed = Duration.ZERO;
        currentAnnounced = false;
        transition(StepperState.IDLE);
    }

    /**
     * External stop: cancels any pending auto-advance and ends the run without completing it.
     */
    public synchronized void stop() {
        if (state == StepperState.FINISHED) {
            return;
        }
        if (state == StepperState.PLAYING) {
            elapsed = liveElapsed();
        }
        finish(false);
    }

    public synchronized StepperState getState() {
        return state;
    }

    public synchronized int getCurrentStep() {
        return currentStep;
    }

    public synchronized int getCycle() {
        return cycle;
    }

    public synchronized Duration getElapsed() {
        return state == StepperState.PLAYING ? liveElapsed() : elapsed;
    }

    public synchronized boolean hasPendingAdvance() {
        return pending != null;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    public String getName() {
        return name;
    }

    private void onTimer(long firedGeneration) {
        synchronized (this) {
            if (firedGeneration != generation || state != StepperState.PLAYING) {
                return;
            }
            pending = null;
            elapsed = timeline.endOf(cycle, currentStep);
            if (!moveToNext()) {
                finish(true);
                return;
            }
            announceCurrent();
            if (state == StepperState.PLAYING) {
                scheduleAdvance();
            }
        }
    }

    private boolean moveToNext() {
        int nextStep = currentStep + 1;
        int nextCycle = cycle;
        if (nextStep >= timeline.size()) {
            if (!timeline.isLooping()) {
                return false;
            }
            nextStep = 0;
            nextCycle++;
        }
        if (!timeline.exists(nextCycle, nextStep)) {
            return false;
        }
        cycle = nextCycle;
        currentStep = nextStep;
        currentAnnounced = false;
        return true;
    }

    private void scheduleAdvance() {
        Duration remaining = timeline.endOf(cycle, currentStep).minus(elapsed);
        if (remaining.isNegative()) {
            remaining = Duration.ZERO;
        }
        long token = ++generation;
        anchorMillis = scheduler.nowMillis();
        elapsedAtAnchor = elapsed;
        pending = scheduler.schedule(timeScale.toWallClock(remaining), () -> onTimer(token));
    }

    private void cancelPending() {
        generation++;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    private Duration liveElapsed() {
        Duration wall = Duration.ofMillis(Math.max(0, scheduler.nowMillis() - anchorMillis));
        Duration live = elapsedAtAnchor.plus(timeScale.toTimeline(wall));
        Duration end = timeline.endOf(cycle, currentStep);
        return live.compareTo(end) > 0 ? end : live;
    }

    private void finish(boolean completed) {
        cancelPending();
        if (completed) {
            elapsed = timeline.getTotalDuration();
        }
        transition(StepperState.FINISHED);
        try {
            listener.onFinished(this, completed);
        } catch (RuntimeException e) {
            LOGGER.warn("Stepper '{}' finish listener failed", name, e);
        }
    }

    private void announceCurrent() {
        if (currentAnnounced) {
            return;
        }
        currentAnnounced = true;
        try {
            listener.onActionStarted(this, timeline.segment(currentStep), cycle);
        } catch (RuntimeException e) {
            LOGGER.warn("Stepper '{}' listener failed on action {} (cycle {})", name, currentStep, cycle, e);
        }
    }

    private void transition(StepperState next) {
        StepperState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOGGER.debug("Stepper '{}': {} -> {} at step {} cycle {}", name, previous, next, currentStep, cycle);
        try {
            listener.onStateChanged(this, previous, next);
        } catch (RuntimeException e) {
            LOGGER.warn("Stepper '{}' state listener failed", name, e);
        }
    }
}
