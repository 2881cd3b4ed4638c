package com.autofix.core.retry;

import java.util.List;

/**
 * Thrown when every attempt of a wrapped operation has failed.
 */
public class RetryExhaustedException extends RuntimeException {

    private final List<AttemptError> attempts;

    public RetryExhaustedException(String message, List<AttemptError> attempts, Throwable cause) {
        super(message, cause);
        this.attempts = List.copyOf(attempts);
    }

    /**
     * All failed attempts in order.
     */
    public List<AttemptError> attempts() {
        return attempts;
    }
}
