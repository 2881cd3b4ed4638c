package com.autofix.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A single tracked work item as supplied by the issue tracker.
 *
 * @param number       tracker-assigned issue number
 * @param title        issue title
 * @param body         raw issue body (not parsed here)
 * @param type         work kind
 * @param priority     urgency
 * @param labels       tracker labels
 * @param component    owning component, may be empty
 * @param relatedFiles repository-relative paths mentioned by the issue
 * @param url          browser URL of the issue
 */
public record Issue(
    int number,
    String title,
    String body,
    IssueType type,
    IssuePriority priority,
    List<String> labels,
    String component,
    List<String> relatedFiles,
    String url
) implements Serializable {

    public Issue {
        labels = labels == null ? List.of() : List.copyOf(labels);
        relatedFiles = relatedFiles == null ? List.of() : List.copyOf(relatedFiles);
        component = component == null ? "" : component;
        body = body == null ? "" : body;
        type = type == null ? IssueType.BUG : type;
        priority = priority == null ? IssuePriority.MEDIUM : priority;
    }
}
