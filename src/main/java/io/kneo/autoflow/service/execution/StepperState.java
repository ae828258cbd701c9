package io.kneo.autoflow.service.execution;

public enum StepperState {
    IDLE,
    PLAYING,
    PAUSED,
    FINISHED
}
