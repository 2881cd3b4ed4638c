package com.autofix.core.fix;

import com.autofix.core.model.CheckResult;
import com.autofix.core.model.CheckRun;
import com.autofix.core.model.CheckStatus;
import com.autofix.core.model.CheckType;

import java.util.stream.Collectors;

/**
 * Decides whether another fix iteration is worthwhile and what to tell the AI integration
 * about the previous one.
 */
public class RetryStrategy {

    static final int FEEDBACK_LINES = 5;

    /**
     * Retry only when at least one check actually ran and reported {@code FAILED}.
     * Timeouts and unexecuted checks point at the environment, so they are not retried.
     */
    public boolean shouldRetry(FixAttempt last, int attemptsMade, int maxAttempts) {
        if (last.success() || attemptsMade >= maxAttempts) {
            return false;
        }
        CheckResult checks = last.checkResult();
        if (checks == null || !checks.anyExecuted()) {
            return false;
        }
        return checks.results().stream().anyMatch(r -> r.status() == CheckStatus.FAILED);
    }

    public String generateFeedback(int attempt, CheckResult checks) {
        StringBuilder sb = new StringBuilder("Attempt ").append(attempt).append(" failed.\n");
        for (CheckRun run : checks.failedChecks()) {
            sb.append("\n### ").append(run.check().scriptName())
              .append(" (").append(run.status().name().toLowerCase()).append(")\n");
            String output = run.stderr().isBlank() ? run.stdout() : run.stderr();
            String excerpt = output.lines().limit(FEEDBACK_LINES).collect(Collectors.joining("\n"));
            if (!excerpt.isBlank()) {
                sb.append("```\n").append(excerpt).append("\n```\n");
            }
            sb.append(suggestionFor(run.check())).append('\n');
        }
        return sb.toString();
    }

    static String suggestionFor(CheckType check) {
        if (check == null) {
            return "Review the failure output and adjust the change.";
        }
        return switch (check) {
            case TEST -> "Re-examine the change: existing behaviour covered by the tests must be preserved.";
            case TYPECHECK -> "Fix the type errors by correcting the type annotations, not by suppressing them.";
            case LINT -> "Fix the reported style violations.";
        };
    }
}
