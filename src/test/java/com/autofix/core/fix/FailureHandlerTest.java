package com.autofix.core.fix;

import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.CheckResult;
import com.autofix.core.model.CheckRun;
import com.autofix.core.model.CheckStatus;
import com.autofix.core.model.CheckType;
import com.autofix.core.model.FailureSummary;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.IssuePriority;
import com.autofix.core.model.IssueType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class FailureHandlerTest {

    private final FailureHandler handler = new FailureHandler();

    private static IssueGroup groupOf(int issues) {
        List<Issue> list = IntStream.rangeClosed(1, issues)
                .mapToObj(n -> new Issue(n, "Issue " + n, "", IssueType.BUG, IssuePriority.MEDIUM,
                        List.of(), "", List.of(), ""))
                .toList();
        return IssueGroup.of("g", "Group", "fix/g", list);
    }

    @Test
    void noAttempts() {
        FailureSummary summary = handler.summarize(groupOf(1), List.of());

        assertEquals("No attempts made", summary.reason());
        assertEquals(0, summary.attempts());
        assertEquals(List.of("Review the issue manually."), summary.suggestions());
    }

    @Test
    void repeatedCheckFailures() {
        CheckResult checks = CheckResult.of(List.of(
                new CheckRun(CheckType.LINT, CheckStatus.FAILED, 1, "", "no-unused-vars", 1),
                new CheckRun(CheckType.TEST, CheckStatus.FAILED, 1, "1 failing", "", 1)), 2);
        FixAttempt last = new FixAttempt(2, List.of(), checks, false, Instant.now());

        FailureSummary summary = handler.summarize(groupOf(1), List.of(last, last));

        assertEquals("2 checks failed repeatedly", summary.reason());
        assertEquals(2, summary.attempts());
        assertEquals(List.of("lint: no-unused-vars", "test: 1 failing"), summary.failedChecks());
        assertEquals(2, summary.suggestions().size());
    }

    @Test
    void largeGroupsGetSplittingAdvice() {
        FailureSummary summary = handler.summarize(groupOf(4),
                StageError.of(OrchestratorErrorCode.PUSH_FAILED, "rejected"), 1);

        assertEquals("PUSH_FAILED: rejected", summary.reason());
        assertTrue(summary.suggestions().get(0).startsWith("Split this group: 4 issues"));
    }

    @Test
    void commentContainsEverySection() {
        FailureSummary summary = new FailureSummary("1 check failed repeatedly", 3,
                List.of("test: boom"), List.of("Run the tests."));

        String comment = handler.formatComment(summary);

        assertTrue(comment.startsWith("## Automated Fix Failed"));
        assertTrue(comment.contains("**Attempts:** 3"));
        assertTrue(comment.contains("- `test: boom`"));
        assertTrue(comment.contains("- Run the tests."));
        assertTrue(comment.contains("`needs-manual-fix`"));
    }
}
