package io.kneo.autoflow.service.execution;

public interface StepListener {

    default void onActionStarted(FlowStepper stepper, TimelineSegment segment, int cycle) {
    }

    default void onStateChanged(FlowStepper stepper, StepperState from, StepperState to) {
    }

    /**
     * @param completed false when the stepper was stopped before reaching the end
     */
    default void onFinished(FlowStepper stepper, boolean completed) {
    }
}
