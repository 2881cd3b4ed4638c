package com.autofix.core.pipeline;

import com.autofix.core.error.StageError;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.Workspace;
import com.autofix.core.process.CommandResult;
import com.autofix.core.result.Result;
import com.autofix.vcs.VersionControl;
import com.autofix.vcs.WorktreeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Allocates the group's worktree on a new branch cut from the base branch.
 */
public class WorkspaceStage implements PipelineStage<Workspace> {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStage.class);

    private final WorktreeRegistry registry;
    private final VersionControl versionControl;
    private final String baseBranch;

    public WorkspaceStage(WorktreeRegistry registry, VersionControl versionControl, String baseBranch) {
        this.registry = registry;
        this.versionControl = versionControl;
        this.baseBranch = baseBranch;
    }

    @Override
    public String name() {
        return "workspace";
    }

    @Override
    public Result<Workspace, StageError> execute(PipelineContext context) {
        IssueGroup group = context.group();
        return registry.acquire(group.branchName(), baseBranch, group.issueNumbers());
    }

    /**
     * Removes the context's workspace, if any. {@code keepBranch=false} also deletes the branch.
     */
    public void cleanup(PipelineContext context, boolean keepBranch) {
        context.takeWorkspace().ifPresent(ws -> {
            Result<Void, StageError> removed = registry.release(ws, keepBranch);
            if (removed.isErr()) {
                log.warn("Cleanup of {} incomplete: {}", ws.path(), removed.error());
            }
        });
    }

    public boolean hasUncommittedChanges(Path path) {
        return versionControl.hasUncommittedChanges(path);
    }

    public Result<CommandResult, StageError> execInWorkspace(Path path, List<String> gitArgs) {
        return versionControl.execInWorkspace(path, gitArgs);
    }

    public String baseBranch() {
        return baseBranch;
    }
}
