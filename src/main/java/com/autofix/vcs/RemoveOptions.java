package com.autofix.vcs;

/**
 * @param force        remove even with uncommitted changes
 * @param deleteBranch also delete the worktree's branch (protected branches are never deleted)
 */
public record RemoveOptions(boolean force, boolean deleteBranch) {

    public static RemoveOptions keepBranch() {
        return new RemoveOptions(true, false);
    }

    public static RemoveOptions deletingBranch() {
        return new RemoveOptions(true, true);
    }
}
