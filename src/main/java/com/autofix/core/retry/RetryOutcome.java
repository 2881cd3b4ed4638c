package com.autofix.core.retry;

import java.util.List;

/**
 * Successful result of a retried operation, with the failures that preceded it.
 */
public record RetryOutcome<T>(T value, int attempts, List<AttemptError> previousErrors) {

    public RetryOutcome {
        previousErrors = List.copyOf(previousErrors);
    }
}
