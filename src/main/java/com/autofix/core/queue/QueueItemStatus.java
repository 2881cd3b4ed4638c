package com.autofix.core.queue;

/**
 * {@code QUEUED -> PROCESSING -> COMPLETED | FAILED | RETRYING}, {@code RETRYING -> QUEUED}.
 */
public enum QueueItemStatus {
    QUEUED,
    PROCESSING,
    RETRYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
