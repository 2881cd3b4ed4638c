package com.autofix.core.fix;

import com.autofix.core.model.FixResult;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.IssueType;

import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conventional-commit messages for fixed groups.
 */
public class CommitMessageGenerator {

    static final int SUBJECT_LIMIT = 72;

    public String generate(IssueGroup group, FixResult fix) {
        StringBuilder sb = new StringBuilder(subject(group, fix));
        sb.append("\n\n");
        for (Issue issue : group.issues()) {
            sb.append("- #").append(issue.number()).append(' ').append(issue.title()).append('\n');
        }
        sb.append('\n').append(footer(group));
        return sb.toString();
    }

    String subject(IssueGroup group, FixResult fix) {
        String scope = scope(group);
        String prefix = dominantType(group).commitType() + (scope.isEmpty() ? "" : "(" + scope + ")") + ": ";
        String subject = prefix + description(group, fix);
        if (subject.length() > SUBJECT_LIMIT) {
            subject = subject.substring(0, SUBJECT_LIMIT - 3) + "...";
        }
        return subject;
    }

    static IssueType dominantType(IssueGroup group) {
        Map<IssueType, Integer> counts = new EnumMap<>(IssueType.class);
        IssueType best = IssueType.BUG;
        int bestCount = 0;
        for (Issue issue : group.issues()) {
            int count = counts.merge(issue.type(), 1, Integer::sum);
            if (count > bestCount) {
                best = issue.type();
                bestCount = count;
            }
        }
        return best;
    }

    static String scope(IssueGroup group) {
        if (!group.components().isEmpty()) {
            return group.components().get(0);
        }
        if (!group.relatedFiles().isEmpty()) {
            String file = group.relatedFiles().get(0);
            int slash = file.indexOf('/');
            return slash > 0 ? file.substring(0, slash) : "";
        }
        return "";
    }

    private static String description(IssueGroup group, FixResult fix) {
        if (fix != null && !fix.commitMessage().isBlank()) {
            return fix.commitMessage().lines().findFirst().orElse("").strip();
        }
        if (group.issues().size() == 1) {
            return group.issues().get(0).title();
        }
        return "resolve " + group.issues().size() + " issues";
    }

    private static String footer(IssueGroup group) {
        return "Fixes " + group.issues().stream().map(i -> "#" + i.number()).collect(Collectors.joining(", "));
    }
}
