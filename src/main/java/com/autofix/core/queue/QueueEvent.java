package com.autofix.core.queue;

import com.autofix.core.model.GroupResult;

import java.time.Instant;

/**
 * Lifecycle notification from the {@link ProcessingQueue}.
 *
 * @param type      what happened
 * @param groupId   affected group, null for queue-level events
 * @param attempt   attempt number for item events, 0 otherwise
 * @param result    terminal result for {@code ITEM_COMPLETED}/{@code ITEM_FAILED}, else null
 * @param error     failure message for failed or retrying items, else null
 * @param timestamp emission time
 */
public record QueueEvent(QueueEventType type, String groupId, int attempt, GroupResult result, String error,
                         Instant timestamp) {

    static QueueEvent item(QueueEventType type, QueueItem item, GroupResult result, String error) {
        return new QueueEvent(type, item.group().id(), item.attempts(), result, error, Instant.now());
    }

    static QueueEvent queue(QueueEventType type) {
        return new QueueEvent(type, null, 0, null, null, Instant.now());
    }
}
