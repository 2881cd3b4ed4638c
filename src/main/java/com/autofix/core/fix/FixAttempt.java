package com.autofix.core.fix;

import com.autofix.core.model.CheckResult;
import com.autofix.core.model.FileChange;

import java.time.Instant;
import java.util.List;

/**
 * One iteration of the fix/check loop.
 *
 * @param attempt     1-based iteration number
 * @param changes     change set proposed in this iteration
 * @param checkResult checks run against it, null when checks never ran
 * @param success     whether the checks passed
 * @param timestamp   when the iteration finished
 */
public record FixAttempt(int attempt, List<FileChange> changes, CheckResult checkResult, boolean success,
                         Instant timestamp) {

    public FixAttempt {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
