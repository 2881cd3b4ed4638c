package com.autofix.core.queue;

import com.autofix.core.interrupt.InterruptController;
import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.GroupResult;
import com.autofix.core.model.GroupStatus;
import com.autofix.core.model.IssueGroup;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingQueueTest {

    private static IssueGroup group(String id) {
        return IssueGroup.of(id, "Group " + id, "fix/" + id, List.of());
    }

    private static List<IssueGroup> groups(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> group("g" + i)).toList();
    }

    private static GroupResult ok(IssueGroup group, int attempt) {
        return GroupResult.completed(group, attempt, Instant.now(), null, false);
    }

    // -- construction --------------------------------------------------------

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        void rejectsNonPositiveConcurrency() {
            assertThrows(IllegalArgumentException.class, () -> new ProcessingQueue(0, 1));
        }

        @Test
        void rejectsNegativeRetries() {
            assertThrows(IllegalArgumentException.class, () -> new ProcessingQueue(1, -1));
        }

        @Test
        void startWithoutProcessorFails() {
            ProcessingQueue queue = new ProcessingQueue(1, 0);
            queue.enqueue(groups(1));

            assertThrows(IllegalStateException.class, queue::start);
        }
    }

    // -- concurrency ---------------------------------------------------------

    @Nested
    @DisplayName("bounded concurrency")
    class Concurrency {

        @Test
        @DisplayName("five groups with two slots never exceed two in flight")
        void neverExceedsMaxConcurrency() {
            ProcessingQueue queue = new ProcessingQueue(2, 0);
            AtomicInteger current = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            List<Integer> sampledInFlight = Collections.synchronizedList(new ArrayList<>());

            queue.setProcessor((group, attempt) -> {
                int now = current.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                sampledInFlight.add(queue.getStats().inFlight());
                Thread.sleep(30);
                current.decrementAndGet();
                return ok(group, attempt);
            });
            queue.enqueue(groups(5));

            List<GroupResult> results = queue.start();

            assertEquals(5, results.size());
            assertTrue(results.stream().allMatch(GroupResult::isCompleted));
            assertTrue(peak.get() <= 2, "peak " + peak.get());
            assertTrue(sampledInFlight.stream().allMatch(n -> n <= 2));
            assertEquals(5, queue.getStats().completed());
        }

        @Test
        @DisplayName("items are admitted in FIFO order")
        void fifoAdmission() {
            ProcessingQueue queue = new ProcessingQueue(1, 0);
            List<String> started = Collections.synchronizedList(new ArrayList<>());
            queue.setProcessor((group, attempt) -> {
                started.add(group.id());
                return ok(group, attempt);
            });
            queue.enqueue(groups(4));

            queue.start();

            assertEquals(List.of("g1", "g2", "g3", "g4"), started);
        }

        @Test
        @DisplayName("every group yields exactly one result")
        void exactlyOneResultPerGroup() {
            ProcessingQueue queue = new ProcessingQueue(3, 2);
            Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
            queue.setProcessor((group, attempt) -> {
                int n = calls.computeIfAbsent(group.id(), k -> new AtomicInteger()).incrementAndGet();
                if (group.id().endsWith("2") && n < 2) {
                    return GroupResult.failed(group, "transient", attempt, Instant.now());
                }
                if (group.id().endsWith("3")) {
                    throw new IllegalStateException("always broken");
                }
                return ok(group, attempt);
            });
            queue.enqueue(groups(6));

            List<GroupResult> results = queue.start();

            Map<String, Long> perGroup = results.stream()
                    .collect(Collectors.groupingBy(r -> r.group().id(), Collectors.counting()));
            assertEquals(6, perGroup.size());
            assertTrue(perGroup.values().stream().allMatch(c -> c == 1));
            GroupResult broken = results.stream().filter(r -> r.group().id().equals("g3")).findFirst().orElseThrow();
            assertEquals(GroupStatus.FAILED, broken.status());
            assertEquals(3, broken.attempts());
            assertEquals("always broken", broken.error());
        }
    }

    // -- retries -------------------------------------------------------------

    @Nested
    @DisplayName("requeue on failure")
    class Retries {

        @Test
        @DisplayName("always-failing processor with three retries fails after four attempts")
        void exhaustsRetries() {
            ProcessingQueue queue = new ProcessingQueue(1, 3, null,
                    new AutofixMetrics(new SimpleMeterRegistry()));
            List<QueueEvent> events = Collections.synchronizedList(new ArrayList<>());
            queue.on(events::add);
            queue.setProcessor((group, attempt) -> GroupResult.failed(group, "boom", attempt, Instant.now()));
            queue.enqueue(List.of(group("only")));

            List<GroupResult> results = queue.start();

            long retrying = events.stream().filter(e -> e.type() == QueueEventType.ITEM_RETRYING).count();
            long failed = events.stream().filter(e -> e.type() == QueueEventType.ITEM_FAILED).count();
            assertEquals(3, retrying);
            assertEquals(1, failed);
            assertEquals(1, results.size());
            assertEquals(4, results.get(0).attempts());
            assertEquals("boom", results.get(0).error());
        }

        @Test
        @DisplayName("a non-retryable failure fails immediately")
        void nonRetryableFailsImmediately() {
            ProcessingQueue queue = new ProcessingQueue(1, 5);
            AtomicInteger calls = new AtomicInteger();
            queue.setProcessor((group, attempt) -> {
                calls.incrementAndGet();
                return GroupResult.failed(group, "forbidden pattern", "FORBIDDEN_PATTERN_DETECTED", false,
                        attempt, Instant.now());
            });
            queue.enqueue(List.of(group("g")));

            List<GroupResult> results = queue.start();

            assertEquals(1, calls.get());
            assertEquals(1, results.get(0).attempts());
            assertEquals("FORBIDDEN_PATTERN_DETECTED", results.get(0).errorCode());
        }

        @Test
        @DisplayName("a later success completes the group and reports the attempts used")
        void succeedsAfterRetry() {
            ProcessingQueue queue = new ProcessingQueue(1, 2);
            queue.setProcessor((group, attempt) -> attempt < 3
                    ? GroupResult.failed(group, "flaky", attempt, Instant.now())
                    : ok(group, attempt));
            queue.enqueue(List.of(group("g")));

            List<GroupResult> results = queue.start();

            assertTrue(results.get(0).isCompleted());
            assertEquals(3, results.get(0).attempts());
        }
    }

    // -- listeners -----------------------------------------------------------

    @Nested
    @DisplayName("listeners")
    class Listeners {

        @Test
        @DisplayName("a throwing listener does not affect processing or other listeners")
        void throwingListenerIsIsolated() {
            ProcessingQueue queue = new ProcessingQueue(2, 0);
            List<QueueEventType> seen = Collections.synchronizedList(new ArrayList<>());
            queue.on(e -> {
                throw new IllegalStateException("listener bug");
            });
            queue.on(e -> seen.add(e.type()));
            queue.setProcessor((group, attempt) -> ok(group, attempt));
            queue.enqueue(groups(2));

            List<GroupResult> results = queue.start();

            assertEquals(2, results.size());
            assertEquals(2, seen.stream().filter(t -> t == QueueEventType.ITEM_QUEUED).count());
            assertEquals(2, seen.stream().filter(t -> t == QueueEventType.ITEM_COMPLETED).count());
            assertEquals(QueueEventType.QUEUE_COMPLETED, seen.get(seen.size() - 1));
        }

        @Test
        @DisplayName("unsubscribed listeners receive nothing further")
        void unsubscribe() {
            ProcessingQueue queue = new ProcessingQueue(1, 0);
            List<QueueEvent> seen = new ArrayList<>();
            Runnable off = queue.on(seen::add);
            off.run();
            queue.setProcessor((group, attempt) -> ok(group, attempt));
            queue.enqueue(groups(1));

            queue.start();

            assertTrue(seen.isEmpty());
        }
    }

    // -- stop / pause --------------------------------------------------------

    @Nested
    @DisplayName("stop and pause")
    class StopAndPause {

        @Test
        @DisplayName("stop lets the in-flight item finish and fails the rest as interrupted")
        void gracefulStop() throws Exception {
            ProcessingQueue queue = new ProcessingQueue(1, 0);
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            queue.setProcessor((group, attempt) -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return ok(group, attempt);
            });
            queue.enqueue(groups(3));

            CompletableFuture<List<GroupResult>> run = CompletableFuture.supplyAsync(queue::start);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            queue.stop();
            release.countDown();
            List<GroupResult> results = run.get(5, TimeUnit.SECONDS);

            assertEquals(3, results.size());
            assertEquals(1, results.stream().filter(GroupResult::isCompleted).count());
            assertEquals(2, results.stream().filter(r -> "INTERRUPTED".equals(r.errorCode())).count());
        }

        @Test
        @DisplayName("forceStop returns without waiting for the in-flight item")
        void forceStop() throws Exception {
            ProcessingQueue queue = new ProcessingQueue(1, 0);
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            queue.setProcessor((group, attempt) -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return ok(group, attempt);
            });
            queue.enqueue(groups(3));

            CompletableFuture<List<GroupResult>> run = CompletableFuture.supplyAsync(queue::start);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            queue.forceStop();
            List<GroupResult> results = run.get(5, TimeUnit.SECONDS);
            release.countDown();

            assertEquals(List.of("g2", "g3"), results.stream().map(r -> r.group().id()).toList());
            assertTrue(results.stream().allMatch(r -> "INTERRUPTED".equals(r.errorCode())));
            assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
            assertEquals(1, queue.getStats().completed());
        }

        @Test
        @DisplayName("paused queue admits nothing until resumed")
        void pauseAndResume() throws Exception {
            ProcessingQueue queue = new ProcessingQueue(1, 0);
            AtomicInteger processed = new AtomicInteger();
            queue.setProcessor((group, attempt) -> {
                processed.incrementAndGet();
                return ok(group, attempt);
            });
            queue.pause();
            queue.enqueue(groups(2));

            CompletableFuture<List<GroupResult>> run = CompletableFuture.supplyAsync(queue::start);
            Thread.sleep(100);
            assertEquals(0, processed.get());
            assertEquals(2, queue.getStats().pending());

            queue.resume();
            assertEquals(2, run.get(5, TimeUnit.SECONDS).size());
            assertEquals(2, processed.get());
        }
    }

    // -- interrupt -----------------------------------------------------------

    @Test
    @DisplayName("interrupt mid-run: in-flight item finishes, cleanup runs once, exit code 130")
    void interruptDuringProcessing() throws Exception {
        AtomicReference<Runnable> signal = new AtomicReference<>();
        List<Integer> exitCodes = Collections.synchronizedList(new ArrayList<>());
        InterruptController interrupts = new InterruptController(handler -> {
            signal.set(handler);
            return () -> {};
        }, exitCodes::add);
        interrupts.init();

        ProcessingQueue queue = new ProcessingQueue(1, 0, interrupts, null);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger processed = new AtomicInteger();
        queue.setProcessor((group, attempt) -> {
            processed.incrementAndGet();
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return ok(group, attempt);
        });
        queue.enqueue(groups(3));

        AtomicInteger cleanupRuns = new AtomicInteger();
        interrupts.onCleanup(() -> {
            cleanupRuns.incrementAndGet();
            queue.stop();
            queue.awaitIdle(Duration.ofSeconds(5));
        });

        CompletableFuture<List<GroupResult>> run = CompletableFuture.supplyAsync(queue::start);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        CompletableFuture<Void> signalled = CompletableFuture.runAsync(signal.get());
        Thread.sleep(50);
        release.countDown();
        signalled.get(5, TimeUnit.SECONDS);
        List<GroupResult> results = run.get(5, TimeUnit.SECONDS);

        assertEquals(1, processed.get());
        assertEquals(1, cleanupRuns.get());
        interrupts.runCleanup().join();
        assertEquals(1, cleanupRuns.get());
        assertEquals(List.of(130), exitCodes);
        assertEquals(3, results.size());
        assertTrue(results.get(0).isCompleted());
        assertEquals(2, results.stream().filter(r -> !r.isCompleted()).count());
        interrupts.reset();
    }
}
