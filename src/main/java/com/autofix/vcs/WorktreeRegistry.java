package com.autofix.vcs;

import com.autofix.core.error.StageError;
import com.autofix.core.error.WorkspaceErrorCode;
import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.Workspace;
import com.autofix.core.model.WorkspaceStatus;
import com.autofix.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the worktrees held by in-flight groups.
 *
 * <p>A branch (and therefore its worktree) is owned by exactly one holder at a time,
 * and at most {@code maxConcurrent} worktrees exist at once.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #acquire} reserves the branch and creates the worktree</li>
 *   <li>{@link #release} removes it, keeping the branch only on success</li>
 *   <li>{@link #releaseAll} removes whatever is left, used during interrupt cleanup</li>
 * </ol>
 */
public class WorktreeRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorktreeRegistry.class);

    private static final Workspace RESERVED = new Workspace(null, "", "", WorkspaceStatus.CREATING, List.of(), null, null);

    private final VersionControl versionControl;
    private final AutofixMetrics metrics;
    private final int maxConcurrent;

    /** Maps branch name to its live worktree, or to {@link #RESERVED} while it is being created. */
    private final Map<String, Workspace> active = new ConcurrentHashMap<>();

    public WorktreeRegistry(VersionControl versionControl, int maxConcurrent) {
        this(versionControl, maxConcurrent, null);
    }

    public WorktreeRegistry(VersionControl versionControl, int maxConcurrent, AutofixMetrics metrics) {
        this.versionControl = versionControl;
        this.maxConcurrent = maxConcurrent;
        this.metrics = metrics;
    }

    public Result<Workspace, StageError> acquire(String branch, String baseBranch, List<Integer> issueNumbers) {
        synchronized (active) {
            if (active.containsKey(branch)) {
                return Result.err(StageError.of(WorkspaceErrorCode.BRANCH_EXISTS,
                        "Branch " + branch + " is held by another in-flight group"));
            }
            if (active.size() >= maxConcurrent) {
                return Result.err(StageError.of(WorkspaceErrorCode.WORKTREE_LIMIT_REACHED,
                        "Worktree limit reached (" + maxConcurrent + ")"));
            }
            active.put(branch, RESERVED);
        }

        Result<Workspace, StageError> created;
        try {
            created = versionControl.createWorkspace(branch, baseBranch, issueNumbers);
        } catch (RuntimeException e) {
            active.remove(branch);
            recordWorktreeMetric("create", false);
            throw e;
        }

        if (created.isOk()) {
            active.put(branch, created.value());
            log.info("Acquired worktree for {} at {}", branch, created.value().path());
        } else {
            active.remove(branch);
            log.warn("Failed to acquire worktree for {}: {}", branch, created.error());
        }
        recordWorktreeMetric("create", created.isOk());
        return created;
    }

    /**
     * Removes the worktree. Unknown or already-released workspaces are ignored.
     */
    public Result<Void, StageError> release(Workspace workspace, boolean keepBranch) {
        if (workspace == null || active.remove(workspace.branch()) == null) {
            return Result.ok(null);
        }
        RemoveOptions options = keepBranch ? RemoveOptions.keepBranch() : RemoveOptions.deletingBranch();
        Result<Void, StageError> removed = versionControl.removeWorkspace(workspace.path(), options);
        recordWorktreeMetric("remove", removed.isOk());
        if (removed.isOk()) {
            log.info("Released worktree for {} (branch {})", workspace.branch(), keepBranch ? "kept" : "deleted");
        } else {
            log.warn("Failed to release worktree {}: {}", workspace.path(), removed.error());
        }
        return removed;
    }

    /**
     * Removes every live worktree, keeping branches so pushed work survives.
     */
    public void releaseAll() {
        List<Workspace> live = new ArrayList<>();
        for (Workspace ws : active.values()) {
            if (ws != RESERVED) {
                live.add(ws);
            }
        }
        log.info("Releasing {} active worktree(s)", live.size());
        for (Workspace ws : live) {
            release(ws, true);
        }
    }

    public int getActiveWorktreeCount() {
        return active.size();
    }

    public boolean isHeld(String branch) {
        return active.containsKey(branch);
    }

    private void recordWorktreeMetric(String operation, boolean success) {
        if (metrics != null) {
            metrics.recordWorktreeOperation(operation, success);
        }
    }
}
