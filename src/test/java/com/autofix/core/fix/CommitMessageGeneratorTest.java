package com.autofix.core.fix;

import com.autofix.core.model.FixResult;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.IssuePriority;
import com.autofix.core.model.IssueType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommitMessageGeneratorTest {

    private final CommitMessageGenerator generator = new CommitMessageGenerator();

    private static Issue issue(int number, String title, IssueType type, String component, String file) {
        return new Issue(number, title, "", type, IssuePriority.MEDIUM, List.of(), component,
                file == null ? List.of() : List.of(file), "");
    }

    @Test
    void singleIssueUsesItsTitleAndComponent() {
        IssueGroup group = IssueGroup.of("g", "g", "fix/g",
                List.of(issue(12, "handle empty input", IssueType.BUG, "parser", null)));

        String message = generator.generate(group, null);

        assertTrue(message.startsWith("fix(parser): handle empty input\n\n"));
        assertTrue(message.contains("- #12 handle empty input"));
        assertTrue(message.endsWith("Fixes #12"));
    }

    @Test
    void dominantTypeAndFileScope() {
        IssueGroup group = IssueGroup.of("g", "g", "fix/g", List.of(
                issue(1, "a", IssueType.FEATURE, "", "web/app.ts"),
                issue(2, "b", IssueType.FEATURE, "", null),
                issue(3, "c", IssueType.BUG, "", null)));

        assertEquals(IssueType.FEATURE, CommitMessageGenerator.dominantType(group));
        assertEquals("web", CommitMessageGenerator.scope(group));
        assertEquals("feat(web): resolve 3 issues", generator.subject(group, null));
        assertTrue(generator.generate(group, null).endsWith("Fixes #1, #2, #3"));
    }

    @Test
    void toolMessageWinsAndLongSubjectsAreTruncated() {
        IssueGroup group = IssueGroup.of("g", "g", "fix/g", List.of(issue(1, "t", IssueType.DOCS, "", null)));
        FixResult fix = new FixResult(List.of(), "s", true, "x".repeat(100) + "\nsecond line");

        String subject = generator.subject(group, fix);

        assertEquals(CommitMessageGenerator.SUBJECT_LIMIT, subject.length());
        assertTrue(subject.startsWith("docs: xxx"));
        assertTrue(subject.endsWith("..."));
    }
}
