package com.autofix.core.error;

/**
 * A member of one of the pipeline error taxonomies.
 */
public interface ErrorCode {

    String name();

    /**
     * Whether another attempt could plausibly succeed. Configuration-class and
     * guardrail errors return false.
     */
    default boolean retryable() {
        return true;
    }
}
