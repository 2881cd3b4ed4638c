package com.autofix.core.queue;

import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.interrupt.InterruptController;
import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.GroupResult;
import com.autofix.core.model.IssueGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded-concurrency work queue for issue groups with per-group requeue on failure.
 * <p>
 * At most {@code maxConcurrency} items are in flight at once. Items are admitted in FIFO
 * order; completions arrive in any order. A failed attempt is requeued while
 * {@code attempt <= maxRetries}, so a group is tried at most {@code maxRetries + 1} times
 * and yields exactly one terminal {@link GroupResult}.
 * <p>
 * The drain loop sleeps on a condition that is signalled on enqueue, completion,
 * pause/resume and stop. Listeners run on the emitting thread, and
 * their exceptions are logged and dropped.
 */
public class ProcessingQueue {

    private static final Logger log = LoggerFactory.getLogger(ProcessingQueue.class);

    private final int maxConcurrency;
    private final int maxRetries;
    private final InterruptController interrupts;
    private final AutofixMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final Deque<QueueItem> pending = new ArrayDeque<>();
    private final Set<QueueItem> inFlight = new LinkedHashSet<>();
    private final List<QueueItem> items = new ArrayList<>();
    private final List<GroupResult> results = new ArrayList<>();
    private final List<QueueListener> listeners = new CopyOnWriteArrayList<>();

    private GroupProcessor processor;
    private ExecutorService workers;
    private long nextSequence;
    private int emitting;
    private boolean paused;
    private boolean stopping;
    private boolean forceStopped;
    private boolean running;

    public ProcessingQueue(int maxConcurrency, int maxRetries) {
        this(maxConcurrency, maxRetries, null, null);
    }

    public ProcessingQueue(int maxConcurrency, int maxRetries, InterruptController interrupts, AutofixMetrics metrics) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxConcurrency = maxConcurrency;
        this.maxRetries = maxRetries;
        this.interrupts = interrupts;
        this.metrics = metrics;
    }

    /**
     * Appends the groups as queued items. Duplicate ids are accepted as separate work.
     */
    public void enqueue(List<IssueGroup> groups) {
        List<QueueEvent> events = new ArrayList<>();
        lock.lock();
        try {
            for (IssueGroup group : groups) {
                QueueItem item = new QueueItem(nextSequence++, group);
                items.add(item);
                pending.addLast(item);
                events.add(QueueEvent.item(QueueEventType.ITEM_QUEUED, item, null, null));
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        events.forEach(this::emit);
    }

    public void setProcessor(GroupProcessor processor) {
        this.processor = processor;
    }

    /**
     * Processes until the queue drains or is stopped, then returns every collected result
     * in arrival order.
     *
     * @throws IllegalStateException if no processor is set or the queue is already running
     */
    public List<GroupResult> start() {
        if (processor == null) {
            throw new IllegalStateException("Processor must be set before start()");
        }
        lock.lock();
        try {
            if (running) {
                throw new IllegalStateException("Queue is already running");
            }
            running = true;
        } finally {
            lock.unlock();
        }

        AtomicInteger threadIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r, "autofix-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Queue started: {} item(s), maxConcurrency={}, maxRetries={}",
                getStats().pending(), maxConcurrency, maxRetries);

        boolean emptyAnnounced = false;
        lock.lock();
        try {
            while (!forceStopped) {
                if (!paused && !stopping && !isInterrupted()) {
                    admit();
                }
                if (pending.isEmpty() && !emptyAnnounced) {
                    emptyAnnounced = true;
                    emitHoldingLock(QueueEvent.queue(QueueEventType.QUEUE_EMPTY));
                } else if (!pending.isEmpty()) {
                    emptyAnnounced = false;
                }
                boolean idle = inFlight.isEmpty() && emitting == 0;
                boolean drained = pending.isEmpty() && idle;
                boolean halted = (stopping || isInterrupted()) && idle;
                if (drained || halted) {
                    break;
                }
                changed.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Queue drain loop interrupted, abandoning {} in-flight item(s)", inFlight.size());
            forceStopped = true;
        } finally {
            abandonPending();
            running = false;
            lock.unlock();
        }

        workers.shutdown();
        List<GroupResult> snapshot;
        lock.lock();
        try {
            snapshot = List.copyOf(results);
        } finally {
            lock.unlock();
        }
        emit(QueueEvent.queue(QueueEventType.QUEUE_COMPLETED));
        log.info("Queue finished with {} result(s)", snapshot.size());
        return snapshot;
    }

    /** Stops admitting new items; in-flight items continue. */
    public void pause() {
        lock.lock();
        try {
            paused = true;
            log.info("Queue paused");
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            changed.signalAll();
            log.info("Queue resumed");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Graceful stop: no new admissions, in-flight items finish, then {@link #start()} returns.
     */
    public void stop() {
        lock.lock();
        try {
            stopping = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns from {@link #start()} immediately. In-flight results that arrive later are still
     * recorded but are not part of the returned list.
     */
    public void forceStop() {
        lock.lock();
        try {
            stopping = true;
            forceStopped = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until nothing is in flight.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!inFlight.isEmpty() || emitting > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public QueueStats getStats() {
        lock.lock();
        try {
            int completed = 0;
            int failed = 0;
            for (QueueItem item : items) {
                if (item.status() == QueueItemStatus.COMPLETED) completed++;
                else if (item.status() == QueueItemStatus.FAILED) failed++;
            }
            return new QueueStats(items.size(), pending.size(), inFlight.size(), completed, failed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subscribes to lifecycle events.
     *
     * @return an action that unsubscribes
     */
    public Runnable on(QueueListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // -- internals; lock held unless noted ---------------------------------

    private void admit() {
        while (inFlight.size() < maxConcurrency && !pending.isEmpty()) {
            QueueItem item = pending.pollFirst();
            item.setStatus(QueueItemStatus.PROCESSING);
            int attempt = item.beginAttempt();
            inFlight.add(item);
            workers.execute(() -> runAttempt(item, attempt));
        }
    }

    /** Runs on a worker thread without the lock. */
    private void runAttempt(QueueItem item, int attempt) {
        emit(QueueEvent.item(QueueEventType.ITEM_STARTED, item, null, null));
        GroupResult result;
        try {
            result = processor.process(item.group(), attempt);
            if (result == null) {
                result = GroupResult.failed(item.group(), "Processor returned no result", attempt, item.firstStartedAt());
            }
        } catch (Exception e) {
            log.warn("Processor threw for group {} on attempt {}: {}", item.group().id(), attempt, e.getMessage(), e);
            result = GroupResult.failed(item.group(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    attempt, item.firstStartedAt());
        }
        finish(item, result.withAttempts(attempt, item.firstStartedAt()));
    }

    private void finish(QueueItem item, GroupResult result) {
        QueueEvent event;
        lock.lock();
        try {
            inFlight.remove(item);
            int attempt = item.attempts();
            if (result.isCompleted()) {
                item.setStatus(QueueItemStatus.COMPLETED);
                recordTerminal(item, result);
                event = QueueEvent.item(QueueEventType.ITEM_COMPLETED, item, result, null);
            } else if (result.retryable() && attempt <= maxRetries && !stopping && !isInterrupted()) {
                item.setStatus(QueueItemStatus.RETRYING);
                item.setLastError(result.error());
                event = QueueEvent.item(QueueEventType.ITEM_RETRYING, item, null, result.error());
                // requeue before releasing the lock so the drain loop never sees the item missing
                item.setStatus(QueueItemStatus.QUEUED);
                pending.addLast(item);
                if (metrics != null) {
                    metrics.incrementQueueRetries();
                }
                log.info("Requeueing group {} after attempt {}: {}", item.group().id(), attempt, result.error());
            } else {
                item.setStatus(QueueItemStatus.FAILED);
                item.setLastError(result.error());
                recordTerminal(item, result);
                event = QueueEvent.item(QueueEventType.ITEM_FAILED, item, result, result.error());
            }
            emitting++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        try {
            emit(event);
        } finally {
            // start() returns only after every item event has been delivered
            lock.lock();
            try {
                emitting--;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private void recordTerminal(QueueItem item, GroupResult result) {
        item.setResult(result);
        results.add(result);
        if (metrics != null) {
            metrics.recordGroupResult(result.status().name().toLowerCase());
            metrics.recordGroupDuration(result.duration());
        }
    }

    /** Terminates every item still waiting, so each enqueued group gets a result. */
    private void abandonPending() {
        while (!pending.isEmpty()) {
            QueueItem item = pending.pollFirst();
            item.setStatus(QueueItemStatus.FAILED);
            GroupResult result = GroupResult.failed(item.group(), "Queue stopped before the group was processed",
                    OrchestratorErrorCode.INTERRUPTED.name(), false, item.attempts(), item.firstStartedAt());
            recordTerminal(item, result);
            emitHoldingLock(QueueEvent.item(QueueEventType.ITEM_FAILED, item, result, result.error()));
        }
    }

    private boolean isInterrupted() {
        return interrupts != null && interrupts.isInterrupted();
    }

    /**
     * Emits while the lock is held. Only used for queue-level events and for the
     * final abandon pass, when no worker can be waiting on the emitter.
     */
    private void emitHoldingLock(QueueEvent event) {
        emit(event);
    }

    private void emit(QueueEvent event) {
        for (QueueListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Queue listener failed on {}: {}", event.type().wireName(), e.getMessage(), e);
            }
        }
    }
}
