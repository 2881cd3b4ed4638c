package com.autofix.core.model;

import java.util.List;

/**
 * Change set applied by the AI integration inside a workspace.
 *
 * @param changes       files written or removed
 * @param summary       description of the change
 * @param success       whether the tool reported success
 * @param commitMessage commit message suggested by the tool, may be blank
 */
public record FixResult(List<FileChange> changes, String summary, boolean success, String commitMessage) {

    public FixResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
        commitMessage = commitMessage == null ? "" : commitMessage;
    }

    public List<String> filesModified() {
        return changes.stream().map(FileChange::path).toList();
    }
}
