package com.autofix.core.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff for a single external invocation.
 * <p>
 * An operation given {@code maxRetries} is attempted at most {@code maxRetries + 1} times.
 * Before attempt {@code n + 1} the caller waits {@code min(1000 * 2^(n-1), 10000)} ms.
 */
public class Backoff {

    private static final Logger log = LoggerFactory.getLogger(Backoff.class);

    static final long BASE_DELAY_MS = 1_000;
    static final long MAX_DELAY_MS = 10_000;

    private final Sleeper sleeper;

    public Backoff() {
        this(Sleeper.SYSTEM);
    }

    public Backoff(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based index of the attempt that just failed
     */
    public static long delayFor(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 20);
        return Math.min(BASE_DELAY_MS * (1L << exponent), MAX_DELAY_MS);
    }

    public <T> RetryOutcome<T> withRetry(Callable<T> operation, int maxRetries) {
        return withRetry(operation, maxRetries, "operation");
    }

    /**
     * Runs the operation until it succeeds or the budget is spent.
     *
     * @param operation  the fallible call
     * @param maxRetries retries after the first attempt
     * @param label      name recorded with each failure
     * @return the value plus the errors of the failed attempts before it
     * @throws RetryExhaustedException carrying every attempt's error once all attempts fail
     */
    public <T> RetryOutcome<T> withRetry(Callable<T> operation, int maxRetries, String label) {
        return withRetry(operation, maxRetries, label, e -> true);
    }

    /**
     * As {@link #withRetry(Callable, int, String)}, but stops early when {@code retryIf}
     * rejects a failure.
     */
    public <T> RetryOutcome<T> withRetry(Callable<T> operation, int maxRetries, String label,
                                         Predicate<Exception> retryIf) {
        int totalAttempts = Math.max(maxRetries, 0) + 1;
        List<AttemptError> errors = new ArrayList<>();
        Exception last = null;

        for (int attempt = 1; attempt <= totalAttempts; attempt++) {
            try {
                T value = operation.call();
                if (!errors.isEmpty()) {
                    log.info("{} succeeded on attempt {} after {} failure(s)", label, attempt, errors.size());
                }
                return new RetryOutcome<>(value, attempt, errors);
            } catch (Exception e) {
                last = e;
                errors.add(new AttemptError(attempt, label, messageOf(e), Instant.now()));
                if (attempt == totalAttempts) {
                    break;
                }
                if (!retryIf.test(e)) {
                    throw new RetryExhaustedException(
                            "Not retryable after " + attempt + " attempts: " + messageOf(e), errors, e);
                }
                long delay = delayFor(attempt);
                log.warn("{} failed on attempt {}/{}: {}. Retrying in {}ms",
                        label, attempt, totalAttempts, messageOf(e), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(
                            "Interrupted after " + attempt + " attempts: " + messageOf(e), errors, ie);
                }
            }
        }

        throw new RetryExhaustedException(
                "Failed after " + totalAttempts + " attempts: " + messageOf(last), errors, last);
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown error";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
