package io.kneo.autoflow.service.execution;

import io.kneo.autoflow.model.action.ActionDurationDefaults;
import io.kneo.autoflow.model.action.FlowAction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cumulative offsets of a flow's actions. A looping timeline repeats the sequence until its
 * bound and is never materialised: positions are derived with modulo arithmetic.
 */
public final class Timeline {
    private final List<TimelineSegment> segments;
    private final Duration sequenceDuration;
    private final Duration loopBound;

    private Timeline(List<TimelineSegment> segments, Duration sequenceDuration, Duration loopBound) {
        this.segments = segments;
        this.sequenceDuration = sequenceDuration;
        this.loopBound = loopBound;
    }

    public static Timeline of(List<FlowAction> actions, ActionDurationDefaults defaults) {
        return looping(actions, defaults, null);
    }

    /**
     * @param loopBound how long the repetition may run; null, non-positive, or a zero-length
     *                  sequence produce a single pass
     */
    public static Timeline looping(List<FlowAction> actions, ActionDurationDefaults defaults, Duration loopBound) {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("Timeline needs at least one action");
        }
        List<TimelineSegment> segments = new ArrayList<>(actions.size());
        Duration cursor = Duration.ZERO;
        for (int i = 0; i < actions.size(); i++) {
            FlowAction action = actions.get(i);
            Duration duration = action.estimateDuration(defaults);
            if (duration.isNegative()) {
                duration = Duration.ZERO;
            }
            segments.add(new TimelineSegment(i, action, cursor, duration, action.isValid()));
            cursor = cursor.plus(duration);
        }
        Duration bound = loopBound;
        if (bound != null && (bound.isNegative() || bound.isZero() || cursor.isZero())) {
            bound = null;
        }
        return new Timeline(Collections.unmodifiableList(segments), cursor, bound);
    }

    public List<TimelineSegment> getSegments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public TimelineSegment segment(int index) {
        return segments.get(index);
    }

    public Duration getSequenceDuration() {
        return sequenceDuration;
    }

    public boolean isLooping() {
        return loopBound != null;
    }

    public Duration getTotalDuration() {
        return isLooping() ? loopBound : sequenceDuration;
    }

    public Duration startOf(int cycle, int index) {
        return sequenceDuration.multipliedBy(cycle).plus(segments.get(index).start());
    }

    /**
     * End of an action occurrence, truncated at the loop bound.
     */
    public Duration endOf(int cycle, int index) {
        Duration end = startOf(cycle, index).plus(segments.get(index).duration());
        Duration total = getTotalDuration();
        return end.compareTo(total) > 0 ? total : end;
    }

    /**
     * Whether the action occurrence starts before the timeline ends. Every action of a
     * single pass exists, including zero-length actions at the very end.
     */
    public boolean exists(int cycle, int index) {
        if (index < 0 || index >= segments.size() || cycle < 0) {
            return false;
        }
        if (!isLooping()) {
            return cycle == 0;
        }
        return startOf(cycle, index).compareTo(loopBound) < 0;
    }

    public TimelinePosition positionAt(Duration elapsed) {
        Duration t = elapsed.isNegative() ? Duration.ZERO : elapsed;
        Duration total = getTotalDuration();
        if (t.compareTo(total) >= 0) {
            return lastPosition();
        }
        int cycle = 0;
        Duration offset = t;
        if (isLooping()) {
            long seqNanos = sequenceDuration.toNanos();
            cycle = (int) (t.toNanos() / seqNanos);
            offset = Duration.ofNanos(t.toNanos() % seqNanos);
        }
        int index = indexAt(offset);
        return new TimelinePosition(cycle, index, offset.minus(segments.get(index).start()));
    }

    private TimelinePosition lastPosition() {
        if (!isLooping()) {
            int last = segments.size() - 1;
            return new TimelinePosition(0, last, segments.get(last).duration());
        }
        long seqNanos = sequenceDuration.toNanos();
        long boundNanos = loopBound.toNanos();
        int cycle = (int) ((boundNanos - 1) / seqNanos);
        Duration offset = Duration.ofNanos(boundNanos - cycle * seqNanos);
        int index = indexAt(offset.minusNanos(1));
        return new TimelinePosition(cycle, index, offset.minus(segments.get(index).start()));
    }

    // last segment whose start is <= offset
    private int indexAt(Duration offset) {
        int low = 0;
        int high = segments.size() - 1;
        int found = 0;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (segments.get(mid).start().compareTo(offset) <= 0) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found;
    }
}
