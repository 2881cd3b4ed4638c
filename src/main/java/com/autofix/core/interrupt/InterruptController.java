package com.autofix.core.interrupt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Process-wide cooperative cancellation.
 * <p>
 * Holds an interrupted flag that pipeline layers consult at stage and iteration
 * boundaries, plus an ordered list of cleanup actions. Cleanup runs at most once per
 * lifecycle: concurrent callers of {@link #runCleanup()} share the same future.
 * <p>
 * On a termination signal the controller:
 * <ol>
 *   <li>sets the interrupted flag</li>
 *   <li>runs cleanup and waits for it</li>
 *   <li>restores the previously installed handlers</li>
 *   <li>terminates with exit code {@value #INTERRUPT_EXIT_CODE}</li>
 * </ol>
 * Tests construct isolated instances and call {@link #reset()} between cases.
 */
@Service
public class InterruptController {

    private static final Logger log = LoggerFactory.getLogger(InterruptController.class);

    /** 128 + SIGINT. */
    public static final int INTERRUPT_EXIT_CODE = 130;

    private final SignalRegistrar signalRegistrar;
    private final IntConsumer exitHook;

    private final AtomicBoolean interrupted = new AtomicBoolean(false);
    private final AtomicBoolean installed = new AtomicBoolean(false);
    private final List<CleanupAction> cleanupActions = new ArrayList<>();
    private final AtomicReference<CompletableFuture<Void>> cleanupRun = new AtomicReference<>();
    private volatile Runnable restoreHandlers = () -> {};

    public InterruptController() {
        this(new ShutdownHookSignalRegistrar(), code -> Runtime.getRuntime().halt(code));
    }

    public InterruptController(SignalRegistrar signalRegistrar, IntConsumer exitHook) {
        this.signalRegistrar = signalRegistrar;
        this.exitHook = exitHook;
    }

    /**
     * Installs the signal handler. Repeated calls are no-ops until {@link #reset()}.
     */
    public void init() {
        if (installed.compareAndSet(false, true)) {
            restoreHandlers = signalRegistrar.install(this::handleSignal);
            log.debug("Interrupt handler installed");
        }
    }

    /**
     * Restores prior handlers and returns to a fresh, uninterrupted state.
     */
    public void reset() {
        if (installed.compareAndSet(true, false)) {
            restoreHandlers.run();
            restoreHandlers = () -> {};
        }
        interrupted.set(false);
        synchronized (cleanupActions) {
            cleanupActions.clear();
        }
        cleanupRun.set(null);
    }

    public boolean isInterrupted() {
        return interrupted.get();
    }

    /**
     * Sets the interrupted flag. Idempotent.
     */
    public void requestInterrupt() {
        if (interrupted.compareAndSet(false, true)) {
            log.warn("Interrupt requested; no new work will be started");
        }
    }

    /**
     * Registers an action to run during shutdown.
     *
     * @return a handle that unregisters the action if it has not run yet
     */
    public Registration onCleanup(CleanupAction action) {
        synchronized (cleanupActions) {
            cleanupActions.add(action);
        }
        return () -> {
            synchronized (cleanupActions) {
                cleanupActions.remove(action);
            }
        };
    }

    /**
     * Drains and runs every registered action in registration order. Action failures
     * are logged and skipped. A second caller gets the in-flight (or finished) run.
     */
    public CompletableFuture<Void> runCleanup() {
        CompletableFuture<Void> fresh = new CompletableFuture<>();
        if (!cleanupRun.compareAndSet(null, fresh)) {
            return cleanupRun.get();
        }

        List<CleanupAction> toRun;
        synchronized (cleanupActions) {
            toRun = new ArrayList<>(cleanupActions);
            cleanupActions.clear();
        }

        log.info("Running {} cleanup action(s)", toRun.size());
        for (CleanupAction action : toRun) {
            try {
                action.run();
            } catch (Exception e) {
                log.warn("Cleanup action failed: {}", e.getMessage(), e);
            }
        }
        fresh.complete(null);
        return fresh;
    }

    /**
     * Runs the body with a cleanup action registered for its duration. The action runs only
     * if shutdown happens while the body is executing.
     */
    public <T> T withCleanup(CleanupAction cleanup, Supplier<T> body) {
        Registration registration = onCleanup(cleanup);
        try {
            return body.get();
        } finally {
            registration.remove();
        }
    }

    /**
     * Signal entry point.
     */
    void handleSignal() {
        log.warn("Termination signal received, shutting down");
        requestInterrupt();
        try {
            runCleanup().join();
        } finally {
            if (installed.compareAndSet(true, false)) {
                restoreHandlers.run();
            }
            exitHook.accept(INTERRUPT_EXIT_CODE);
        }
    }

    /**
     * Handle returned by {@link #onCleanup(CleanupAction)}.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
