package com.autofix.core.queue;

public enum QueueEventType {
    ITEM_QUEUED("item_queued"),
    ITEM_STARTED("item_started"),
    ITEM_COMPLETED("item_completed"),
    ITEM_FAILED("item_failed"),
    ITEM_RETRYING("item_retrying"),
    QUEUE_EMPTY("queue_empty"),
    QUEUE_COMPLETED("queue_completed");

    private final String wireName;

    QueueEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
