package io.kneo.autoflow.model.cnst;

/**
 * How a looping flow behaves inside a one-time (possibly multi-day) window.
 */
public enum OneTimeLoopPolicy {
    REPEAT_WITHIN_WINDOW,
    SINGLE_PASS
}
