package com.autofix.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for group processing.
 */
@Service
public class AutofixMetrics {

    private final MeterRegistry registry;

    public AutofixMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGroupResult(String status) {
        Counter.builder("autofix.groups.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordGroupDuration(Duration duration) {
        Timer.builder("autofix.group.duration")
                .register(registry)
                .record(duration);
    }

    public void incrementQueueRetries() {
        Counter.builder("autofix.queue.retries")
                .description("Groups requeued after a failed attempt")
                .register(registry)
                .increment();
    }

    public void recordFixAttempts(int attempts) {
        DistributionSummary.builder("autofix.fix.attempts")
                .description("Fix/check iterations per group attempt")
                .register(registry)
                .record(attempts);
    }

    public void recordCheck(String check, String status, long durationMs) {
        Timer.builder("autofix.check.duration")
                .tag("check", check)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordGuardrailViolation(String code) {
        Counter.builder("autofix.guardrail.violations")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    /**
     * Records worktree operations for monitoring workspace churn.
     *
     * @param operation "create" or "remove"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("autofix.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
