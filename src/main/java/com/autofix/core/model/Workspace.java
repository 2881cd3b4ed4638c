package com.autofix.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Handle to an isolated, branch-scoped working copy.
 *
 * @param path           worktree directory
 * @param branch         branch checked out in the worktree
 * @param baseBranch     branch the worktree was created from
 * @param status         lifecycle status
 * @param issueNumbers   issues the worktree is fixing
 * @param createdAt      creation time
 * @param lastActivityAt last time the handle was touched
 */
public record Workspace(
    Path path,
    String branch,
    String baseBranch,
    WorkspaceStatus status,
    List<Integer> issueNumbers,
    Instant createdAt,
    Instant lastActivityAt
) {

    public Workspace {
        issueNumbers = issueNumbers == null ? List.of() : List.copyOf(issueNumbers);
    }

    public Workspace withStatus(WorkspaceStatus newStatus) {
        return new Workspace(path, branch, baseBranch, newStatus, issueNumbers, createdAt, Instant.now());
    }
}
