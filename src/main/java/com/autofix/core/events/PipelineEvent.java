package com.autofix.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while a group moves through the pipeline.
 *
 * @param eventType e.g. "stage.started", "stage.completed", "stage.failed", "fix.attempt"
 * @param groupId   the issue group being processed
 * @param stage     stage name, may be null for group-level events
 * @param payload   event-specific data
 * @param timestamp emission time
 */
public record PipelineEvent(
    String eventType,
    String groupId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent of(String eventType, String groupId, String stage, Map<String, Object> payload) {
        return new PipelineEvent(eventType, groupId, stage, payload == null ? Map.of() : payload, Instant.now());
    }
}
