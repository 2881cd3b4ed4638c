package com.autofix.core.queue;

@FunctionalInterface
public interface QueueListener {

    void onEvent(QueueEvent event);
}
