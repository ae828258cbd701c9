package io.kneo.autoflow.dto;

import java.util.List;
import java.util.UUID;

public record TimelineDTO(UUID flowId,
                          long sequenceSeconds,
                          long totalSeconds,
                          boolean looping,
                          List<SegmentDTO> segments) {

    public record SegmentDTO(int index, String actionType, String title, long startSeconds, long durationSeconds,
                             boolean valid) {
    }
}
