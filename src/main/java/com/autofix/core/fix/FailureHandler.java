package com.autofix.core.fix;

import com.autofix.core.error.StageError;
import com.autofix.core.model.CheckRun;
import com.autofix.core.model.CheckType;
import com.autofix.core.model.FailureSummary;
import com.autofix.core.model.IssueGroup;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds failure summaries and the issue comment that reports them.
 */
public class FailureHandler {

    public static final List<String> FAILURE_LABELS = List.of("needs-manual-fix", "automated-fix-failed");

    private static final int GROUPING_ADVICE_THRESHOLD = 3;

    public FailureSummary summarize(IssueGroup group, List<FixAttempt> attempts) {
        if (attempts.isEmpty()) {
            return new FailureSummary("No attempts made", 0, List.of(), groupAdvice(group, new ArrayList<>()));
        }
        FixAttempt last = attempts.get(attempts.size() - 1);
        List<CheckRun> failed = last.checkResult() == null ? List.of() : last.checkResult().failedChecks();
        if (failed.isEmpty()) {
            return new FailureSummary("Unknown failure", attempts.size(), List.of(),
                    groupAdvice(group, new ArrayList<>()));
        }

        List<String> failedChecks = new ArrayList<>();
        Set<String> suggestions = new LinkedHashSet<>();
        for (CheckRun run : failed) {
            failedChecks.add(run.check().scriptName() + ": " + run.firstErrorLine());
            suggestions.add(suggestionFor(run.check()));
        }
        String reason = failed.size() + (failed.size() == 1 ? " check" : " checks") + " failed repeatedly";
        return new FailureSummary(reason, attempts.size(), failedChecks, groupAdvice(group, new ArrayList<>(suggestions)));
    }

    /**
     * Summary for a group that stopped on a stage error rather than failing checks.
     */
    public FailureSummary summarize(IssueGroup group, StageError error, int attempts) {
        return new FailureSummary(error.code().name() + ": " + error.message(), attempts, List.of(),
                groupAdvice(group, new ArrayList<>()));
    }

    public String formatComment(FailureSummary summary) {
        StringBuilder sb = new StringBuilder("## Automated Fix Failed\n\n");
        sb.append("**Reason:** ").append(summary.reason()).append("\n\n");
        sb.append("**Attempts:** ").append(summary.attempts()).append("\n\n");
        if (!summary.failedChecks().isEmpty()) {
            sb.append("### Failed checks\n\n");
            summary.failedChecks().forEach(c -> sb.append("- `").append(c).append("`\n"));
            sb.append('\n');
        }
        if (!summary.suggestions().isEmpty()) {
            sb.append("### Suggestions\n\n");
            summary.suggestions().forEach(s -> sb.append("- ").append(s).append('\n'));
            sb.append('\n');
        }
        sb.append("Labels: ");
        sb.append(String.join(", ", FAILURE_LABELS.stream().map(l -> "`" + l + "`").toList()));
        sb.append('\n');
        return sb.toString();
    }

    private static List<String> groupAdvice(IssueGroup group, List<String> suggestions) {
        if (group.issues().size() > GROUPING_ADVICE_THRESHOLD) {
            suggestions.add("Split this group: " + group.issues().size()
                    + " issues were fixed together, try them separately.");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("Review the issue manually.");
        }
        return suggestions;
    }

    private static String suggestionFor(CheckType check) {
        return switch (check) {
            case TEST -> "Run the test suite locally and check which behaviour the fix broke.";
            case TYPECHECK -> "Run the type checker locally and correct the reported types.";
            case LINT -> "Run the linter with autofix enabled.";
        };
    }
}
