package com.autofix.core.model;

/**
 * One file of a proposed change set.
 *
 * @param path       repository-relative path
 * @param content    full new content; empty for deletions
 * @param changeType kind of change
 */
public record FileChange(String path, String content, ChangeType changeType) {

    public FileChange {
        content = content == null ? "" : content;
    }

    public boolean isDeleted() {
        return changeType == ChangeType.DELETED;
    }
}
