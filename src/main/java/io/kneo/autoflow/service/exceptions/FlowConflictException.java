package io.kneo.autoflow.service.exceptions;

import io.kneo.autoflow.service.scheduler.ConflictingFlow;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class FlowConflictException extends RuntimeException {
    private final List<ConflictingFlow> conflicts;

    public FlowConflictException(List<ConflictingFlow> conflicts) {
        super("Schedule conflicts with: " + conflicts.stream()
                .map(ConflictingFlow::name)
                .collect(Collectors.joining(", ")));
        this.conflicts = List.copyOf(conflicts);
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
