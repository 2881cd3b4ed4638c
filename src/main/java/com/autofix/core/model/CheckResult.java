package com.autofix.core.model;

import java.util.List;

/**
 * Aggregate outcome of a check run.
 *
 * @param success         true when every executed check passed
 * @param results         per-check outcomes in execution order
 * @param attempt         orchestrator attempt that produced this result
 * @param totalDurationMs sum of the check durations
 */
public record CheckResult(boolean success, List<CheckRun> results, int attempt, long totalDurationMs) {

    public CheckResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static CheckResult of(List<CheckRun> runs, int attempt) {
        boolean success = runs.stream()
                .allMatch(r -> r.status() == CheckStatus.PASSED || r.status() == CheckStatus.SKIPPED)
                && runs.stream().anyMatch(CheckRun::passed);
        long total = runs.stream().mapToLong(CheckRun::durationMs).sum();
        return new CheckResult(success, runs, attempt, total);
    }

    public List<CheckRun> failedChecks() {
        return results.stream()
                .filter(r -> r.status() == CheckStatus.FAILED || r.status() == CheckStatus.TIMEOUT)
                .toList();
    }

    public boolean anyExecuted() {
        return results.stream().anyMatch(r -> r.status() != CheckStatus.SKIPPED);
    }
}
