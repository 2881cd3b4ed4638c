package com.autofix.core.report;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one run of the queue.
 */
public record RunReport(
    Instant generatedAt,
    int totalGroups,
    int completed,
    int failed,
    double successRate,
    long durationMs,
    List<GroupEntry> groups
) {

    /**
     * Per-group line of the report.
     */
    public record GroupEntry(
        String groupId,
        String name,
        List<Integer> issues,
        String status,
        int attempts,
        long durationMs,
        String publishUrl,
        String errorCode,
        String error,
        boolean dryRun
    ) {}
}
