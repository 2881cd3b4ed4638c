package com.autofix.core.model;

import java.util.List;

/**
 * Why a group could not be fixed, in a form suitable for posting back to its issues.
 */
public record FailureSummary(String reason, int attempts, List<String> failedChecks, List<String> suggestions) {

    public FailureSummary {
        failedChecks = failedChecks == null ? List.of() : List.copyOf(failedChecks);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
