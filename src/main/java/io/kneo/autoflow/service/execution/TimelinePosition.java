package io.kneo.autoflow.service.execution;

import java.time.Duration;

/**
 * Where a cursor is at a given elapsed time: repetition number, action index and offset into that action.
 */
public record TimelinePosition(int cycle, int index, Duration offset) {
}
