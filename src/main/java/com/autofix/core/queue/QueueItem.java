package com.autofix.core.queue;

import com.autofix.core.model.GroupResult;
import com.autofix.core.model.IssueGroup;

import java.time.Instant;

/**
 * Tracking record for one enqueued group. Mutated only under the queue lock.
 */
public final class QueueItem {

    private final long sequence;
    private final IssueGroup group;
    private QueueItemStatus status = QueueItemStatus.QUEUED;
    private int attempts;
    private Instant firstStartedAt;
    private String lastError;
    private GroupResult result;

    QueueItem(long sequence, IssueGroup group) {
        this.sequence = sequence;
        this.group = group;
    }

    public long sequence() { return sequence; }
    public IssueGroup group() { return group; }
    public QueueItemStatus status() { return status; }
    public int attempts() { return attempts; }
    public Instant firstStartedAt() { return firstStartedAt; }
    public String lastError() { return lastError; }
    public GroupResult result() { return result; }

    void setStatus(QueueItemStatus status) { this.status = status; }
    void setLastError(String lastError) { this.lastError = lastError; }
    void setResult(GroupResult result) { this.result = result; }

    int beginAttempt() {
        if (firstStartedAt == null) {
            firstStartedAt = Instant.now();
        }
        return ++attempts;
    }
}
