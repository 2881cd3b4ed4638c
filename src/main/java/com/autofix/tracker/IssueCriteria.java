package com.autofix.tracker;

import java.util.List;

/**
 * Selection of issues to fetch.
 *
 * @param issueNumbers  explicit issue numbers; when non-empty, labels are ignored
 * @param labels        required labels
 * @param excludeLabels labels that exclude an issue
 * @param limit         maximum issues when listing
 */
public record IssueCriteria(List<Integer> issueNumbers, List<String> labels, List<String> excludeLabels, int limit) {

    public IssueCriteria {
        issueNumbers = issueNumbers == null ? List.of() : List.copyOf(issueNumbers);
        labels = labels == null ? List.of() : List.copyOf(labels);
        excludeLabels = excludeLabels == null ? List.of() : List.copyOf(excludeLabels);
    }
}
