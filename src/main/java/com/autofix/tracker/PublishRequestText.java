package com.autofix.tracker;

import com.autofix.core.model.Issue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Title and body of the pull request opened for a group.
 */
final class PublishRequestText {

    private PublishRequestText() {}

    static String title(List<Issue> issues) {
        if (issues.size() == 1) {
            Issue issue = issues.get(0);
            return issue.type().commitType() + ": " + issue.title() + " (#" + issue.number() + ")";
        }
        String refs = issues.stream().map(i -> "#" + i.number()).collect(Collectors.joining(", "));
        return "fix: resolve " + issues.size() + " issues (" + refs + ")";
    }

    static String body(List<Issue> issues) {
        StringBuilder sb = new StringBuilder("## Summary\n\nAutomated fix for:\n\n");
        for (Issue issue : issues) {
            sb.append("- #").append(issue.number()).append(' ').append(issue.title()).append('\n');
        }
        sb.append('\n');
        for (Issue issue : issues) {
            sb.append("Closes #").append(issue.number()).append('\n');
        }
        return sb.toString();
    }
}
