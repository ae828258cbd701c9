package io.kneo.autoflow.service;

import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.dto.TimelineDTO;
import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.action.PlayContent;
import io.kneo.autoflow.model.action.PlayJingle;
import io.kneo.autoflow.model.action.PlayShow;
import io.kneo.autoflow.service.execution.FlowStepper;
import io.kneo.autoflow.service.execution.FlowTimelines;
import io.kneo.autoflow.service.execution.StepListener;
import io.kneo.autoflow.service.execution.TickScheduler;
import io.kneo.autoflow.service.execution.TimeScale;
import io.kneo.autoflow.service.execution.Timeline;
import io.kneo.autoflow.service.execution.TimelineSegment;
import io.kneo.autoflow.service.external.ContentLookup;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Preview steppers and display timelines. Nothing here dispatches or writes; the stepper
 * belongs to whoever asked for it.
 */
@ApplicationScoped
public class FlowPreviewService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowPreviewService.class);

    private final FlowService flowService;
    private final FlowTimelines timelines;
    private final ContentLookup contentLookup;
    private final TickScheduler tickScheduler;
    private final Clock clock;
    private final double speedUp;

    @Inject
    public FlowPreviewService(FlowService flowService,
                              FlowTimelines timelines,
                              ContentLookup contentLookup,
                              TickScheduler tickScheduler,
                              Clock clock,
                              AutoFlowConfig config) {
        this.flowService = flowService;
        this.timelines = timelines;
        this.contentLookup = contentLookup;
        this.tickScheduler = tickScheduler;
        this.clock = clock;
        this.speedUp = config.getPreviewSpeedUp();
    }

    public Uni<FlowStepper> preview(UUID flowId, StepListener listener) {
        return flowService.get(flowId)
                .map(flow -> preview(flow, tickScheduler, TimeScale.speedUp(speedUp), listener));
    }

    public FlowStepper preview(Flow flow, TickScheduler scheduler, TimeScale timeScale, StepListener listener) {
        Timeline timeline = timelines.forPreview(flow, clock.instant());
        LOGGER.debug("Preview of flow '{}': {} action(s), {}s", flow.getName(), timeline.size(),
                timeline.getTotalDuration().toSeconds());
        return new FlowStepper("preview:" + flow.getName(), timeline, scheduler, timeScale, listener);
    }

    public Uni<TimelineDTO> timeline(UUID flowId) {
        return flowService.get(flowId)
                .chain(flow -> {
                    Timeline timeline = timelines.forPreview(flow, clock.instant());
                    List<Uni<TimelineDTO.SegmentDTO>> segments = timeline.getSegments().stream()
                            .map(this::toSegmentDTO)
                            .toList();
                    return Uni.join().all(segments).andFailFast()
                            .map(list -> new TimelineDTO(
                                    flow.getId(),
                                    timeline.getSequenceDuration().toSeconds(),
                                    timeline.getTotalDuration().toSeconds(),
                                    timeline.isLooping(),
                                    list));
                });
    }

    private Uni<TimelineDTO.SegmentDTO> toSegmentDTO(TimelineSegment segment) {
        return titleOf(segment.action())
                .map(title -> new TimelineDTO.SegmentDTO(
                        segment.index(),
                        segment.action().type().getValue(),
                        title,
                        segment.start().toSeconds(),
                        segment.duration().toSeconds(),
                        segment.valid()));
    }

    private Uni<String> titleOf(FlowAction action) {
        if (action.description() != null && !action.description().isBlank()) {
            return Uni.createFrom().item(action.description());
        }
        String reference = null;
        if (action instanceof PlayContent content) {
            reference = content.contentId();
        } else if (action instanceof PlayShow show) {
            reference = show.contentId();
        } else if (action instanceof PlayJingle jingle) {
            reference = jingle.jingleId();
        }
        if (reference == null || reference.isBlank()) {
            return Uni.createFrom().item(action.type().getValue());
        }
        String rawId = reference;
        return contentLookup.resolveContentTitle(rawId)
                .map(title -> title.orElse(rawId))
                .onFailure().recoverWithItem(e -> {
                    LOGGER.warn("Content lookup failed for {}, showing raw id", rawId, e);
                    return rawId;
                });
    }
}
