package com.autofix.core.pipeline;

/**
 * States a group moves through inside one orchestrator run.
 * {@code PUBLISHED} and {@code FAILED} are terminal; {@code RETRY} loops back to {@code FIXING}.
 */
public enum FixState {
    PENDING,
    ANALYZING,
    FIXING,
    VALIDATING,
    CHECKING,
    PUBLISHED,
    RETRY,
    FAILED
}
