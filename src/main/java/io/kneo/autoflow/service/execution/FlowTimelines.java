package io.kneo.autoflow.service.execution;

import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.action.ActionDurationDefaults;
import io.kneo.autoflow.model.cnst.OneTimeLoopPolicy;
import io.kneo.autoflow.model.scheduler.Occurrence;
import io.kneo.autoflow.model.scheduler.Schedule;
import io.kneo.autoflow.service.scheduler.InvalidScheduleException;
import io.kneo.autoflow.service.scheduler.RecurrenceEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Builds the timelines that live runs and previews walk, including the loop bound.
 */
@ApplicationScoped
public class FlowTimelines {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowTimelines.class);
    // stands in for "until stopped"
    static final Duration UNTIL_STOPPED = Duration.ofDays(3650);

    private final RecurrenceEngine recurrenceEngine;
    private final ActionDurationDefaults defaults;
    private final OneTimeLoopPolicy oneTimeLoopPolicy;

    @Inject
    public FlowTimelines(RecurrenceEngine recurrenceEngine, AutoFlowConfig config) {
        this(recurrenceEngine, ActionDurationDefaults.from(config.getDuration()), config.getOneTimeLoopPolicy());
    }

    public FlowTimelines(RecurrenceEngine recurrenceEngine, ActionDurationDefaults defaults, OneTimeLoopPolicy oneTimeLoopPolicy) {
        this.recurrenceEngine = recurrenceEngine;
        this.defaults = defaults;
        this.oneTimeLoopPolicy = oneTimeLoopPolicy;
    }

    public ActionDurationDefaults getDefaults() {
        return defaults;
    }

    /**
     * Timeline of a live run starting at {@code runStart}. A looping flow repeats until the end of
     * the occurrence it was started in; open-ended occurrences and unscheduled flows loop until stopped.
     * A looping run started outside any occurrence plays once.
     */
    public Timeline forRun(Flow flow, Instant runStart) {
        return Timeline.looping(flow.getActions(), defaults, runLoopBound(flow, runStart).orElse(null));
    }

    /**
     * Timeline for previews: a looping flow repeats for the length of its next occurrence.
     */
    public Timeline forPreview(Flow flow, Instant now) {
        Duration bound = null;
        if (flow.isLoop() && flow.isScheduled() && loopsInWindow(flow.getSchedule())) {
            try {
                bound = recurrenceEngine.nextOccurrence(flow.getSchedule(), now)
                        .map(Occurrence::length)
                        .orElse(null);
            } catch (InvalidScheduleException e) {
                LOGGER.warn("Previewing flow {} as a single pass: {}", flow.getId(), e.getMessage());
            }
        }
        return Timeline.looping(flow.getActions(), defaults, bound);
    }

    Optional<Duration> runLoopBound(Flow flow, Instant runStart) {
        if (!flow.isLoop()) {
            return Optional.empty();
        }
        if (!flow.isScheduled()) {
            return Optional.of(UNTIL_STOPPED);
        }
        Schedule schedule = flow.getSchedule();
        if (!loopsInWindow(schedule)) {
            return Optional.empty();
        }
        Optional<Occurrence> current;
        try {
            current = recurrenceEngine.expand(schedule, runStart.minus(Duration.ofDays(1)), runStart.plus(Duration.ofDays(1)))
                    .stream()
                    .filter(occurrence -> occurrence.contains(runStart))
                    .findFirst();
        } catch (InvalidScheduleException e) {
            LOGGER.warn("Flow {} runs once, schedule cannot be expanded: {}", flow.getId(), e.getMessage());
            return Optional.empty();
        }
        if (current.isEmpty()) {
            LOGGER.info("Flow {} started outside its window, looping disabled for this run", flow.getId());
            return Optional.empty();
        }
        Occurrence occurrence = current.get();
        if (occurrence.openEnded()) {
            return Optional.of(UNTIL_STOPPED);
        }
        return Optional.of(Duration.between(runStart, occurrence.end()));
    }

    private boolean loopsInWindow(Schedule schedule) {
        return !schedule.isOneTime() || oneTimeLoopPolicy == OneTimeLoopPolicy.REPEAT_WITHIN_WINDOW;
    }
}
