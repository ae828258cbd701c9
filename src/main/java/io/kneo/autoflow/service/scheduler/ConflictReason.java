package io.kneo.autoflow.service.scheduler;

public enum ConflictReason {
    OVERLAP,
    INVALID_SCHEDULE
}
