package com.autofix.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable unit of work: related issues fixed together on one branch.
 *
 * @param id           group identifier
 * @param name         display name
 * @param issues       ordered source issues
 * @param branchName   target branch for the fix
 * @param relatedFiles union of the issues' related files
 * @param components   union of the issues' components
 * @param priority     highest priority among the issues
 */
public record IssueGroup(
    String id,
    String name,
    List<Issue> issues,
    String branchName,
    List<String> relatedFiles,
    List<String> components,
    IssuePriority priority
) implements Serializable {

    public IssueGroup {
        issues = issues == null ? List.of() : List.copyOf(issues);
        relatedFiles = relatedFiles == null ? List.of() : List.copyOf(relatedFiles);
        components = components == null ? List.of() : List.copyOf(components);
        priority = priority == null ? IssuePriority.MEDIUM : priority;
    }

    /**
     * Builds a group, deriving file and component unions and the highest priority from the issues.
     */
    public static IssueGroup of(String id, String name, String branchName, List<Issue> issues) {
        Set<String> files = new LinkedHashSet<>();
        Set<String> components = new LinkedHashSet<>();
        IssuePriority highest = IssuePriority.LOW;
        for (Issue issue : issues) {
            files.addAll(issue.relatedFiles());
            if (!issue.component().isBlank()) {
                components.add(issue.component());
            }
            if (issue.priority().isHigherThan(highest)) {
                highest = issue.priority();
            }
        }
        return new IssueGroup(id, name, issues, branchName,
                new ArrayList<>(files), new ArrayList<>(components), highest);
    }

    public List<Integer> issueNumbers() {
        return issues.stream().map(Issue::number).toList();
    }
}
