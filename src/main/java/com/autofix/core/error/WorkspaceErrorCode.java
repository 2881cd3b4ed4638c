package com.autofix.core.error;

public enum WorkspaceErrorCode implements ErrorCode {
    INVALID_BRANCH,
    BRANCH_EXISTS,
    BRANCH_NOT_FOUND,
    GIT_ERROR,
    WORKTREE_NOT_FOUND,
    WORKTREE_LIMIT_REACHED,
    UNKNOWN;

    @Override
    public boolean retryable() {
        return this != INVALID_BRANCH;
    }
}
