package com.autofix.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Fan-out of pipeline progress events to in-process listeners.
 * <p>
 * Events are delivered synchronously on the publishing worker thread, in subscription order.
 * Each subscription carries a filter, so the console can follow only the event types it prints.
 * A failing listener is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("{} [{}] {}", event.eventType(), event.groupId(), event.stage() == null ? "" : event.stage());
        for (Registration registration : registrations) {
            if (registration.filter().test(event)) {
                deliver(registration.listener(), event);
            }
        }
    }

    /**
     * Delivers only events accepted by {@code filter}.
     */
    public Subscription subscribe(Predicate<PipelineEvent> filter, Consumer<PipelineEvent> listener) {
        Registration registration = new Registration(filter, listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> listener) {
        return subscribe(event -> true, listener);
    }

    /**
     * Matches events whose type equals one of {@code types} or starts with one ending in a dot,
     * e.g. {@code types("stage.", "guardrail.rejected")}.
     */
    public static Predicate<PipelineEvent> types(String... types) {
        List<String> wanted = List.of(types);
        return event -> wanted.stream().anyMatch(t ->
                t.endsWith(".") ? event.eventType().startsWith(t) : event.eventType().equals(t));
    }

    /** Handle for cancelling a subscription. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<PipelineEvent> listener, PipelineEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event listener failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    private record Registration(Predicate<PipelineEvent> filter, Consumer<PipelineEvent> listener) {}
}
