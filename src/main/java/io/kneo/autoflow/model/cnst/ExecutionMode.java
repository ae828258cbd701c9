package io.kneo.autoflow.model.cnst;

/**
 * DRY_RUN shares every decision with LIVE but suppresses writes and sends dispatches to a no-op sink.
 */
public enum ExecutionMode {
    LIVE,
    DRY_RUN;

    public boolean isDryRun() {
        return this == DRY_RUN;
    }
}
