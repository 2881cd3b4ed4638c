package com.autofix.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Terminal outcome for one processed group.
 *
 * @param group       the group
 * @param status      completed or failed
 * @param error       failure description, null on success
 * @param errorCode   taxonomy code of the failure, null on success
 * @param retryable   whether a later attempt could change the outcome
 * @param attempts    attempts consumed
 * @param startedAt   start of the first attempt
 * @param completedAt end of the last attempt
 * @param publishUrl  URL of the opened request, null when none was opened
 * @param dryRun      true when side-effecting stages were skipped
 * @param failure     why the group failed, for reporting back to its issues; null on success
 */
public record GroupResult(
    IssueGroup group,
    GroupStatus status,
    String error,
    String errorCode,
    boolean retryable,
    int attempts,
    Instant startedAt,
    Instant completedAt,
    String publishUrl,
    boolean dryRun,
    FailureSummary failure
) {

    public static GroupResult completed(IssueGroup group, int attempts, Instant startedAt,
                                        String publishUrl, boolean dryRun) {
        return new GroupResult(group, GroupStatus.COMPLETED, null, null, false, attempts, startedAt,
                Instant.now(), publishUrl, dryRun, null);
    }

    public static GroupResult failed(IssueGroup group, String error, int attempts, Instant startedAt) {
        return failed(group, error, null, true, attempts, startedAt);
    }

    public static GroupResult failed(IssueGroup group, String error, String errorCode, boolean retryable,
                                     int attempts, Instant startedAt) {
        return failed(group, error, errorCode, retryable, attempts, startedAt, null);
    }

    public static GroupResult failed(IssueGroup group, String error, String errorCode, boolean retryable,
                                     int attempts, Instant startedAt, FailureSummary failure) {
        return new GroupResult(group, GroupStatus.FAILED, error, errorCode, retryable, attempts, startedAt,
                Instant.now(), null, false, failure);
    }

    public boolean isCompleted() {
        return status == GroupStatus.COMPLETED;
    }

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    /**
     * Copy carrying the queue-level attempt count and first start time.
     */
    public GroupResult withAttempts(int attemptCount, Instant firstStartedAt) {
        return new GroupResult(group, status, error, errorCode, retryable, attemptCount, firstStartedAt,
                completedAt, publishUrl, dryRun, failure);
    }
}
