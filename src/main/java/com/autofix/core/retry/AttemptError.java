package com.autofix.core.retry;

import java.time.Instant;

/**
 * One failed attempt recorded by {@link Backoff}.
 *
 * @param attempt   1-based attempt index
 * @param operation label of the wrapped operation (e.g. the check name)
 * @param message   failure message
 * @param timestamp when the attempt failed
 */
public record AttemptError(int attempt, String operation, String message, Instant timestamp) {}
