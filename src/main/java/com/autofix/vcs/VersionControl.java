package com.autofix.vcs;

import com.autofix.core.error.StageError;
import com.autofix.core.model.FileChange;
import com.autofix.core.model.Workspace;
import com.autofix.core.process.CommandResult;
import com.autofix.core.result.Result;

import java.nio.file.Path;
import java.util.List;

/**
 * Version-control operations the pipeline needs on isolated workspaces.
 */
public interface VersionControl {

    /**
     * Creates a worktree on a new branch cut from {@code baseBranch}.
     */
    Result<Workspace, StageError> createWorkspace(String branch, String baseBranch, List<Integer> issueNumbers);

    Result<Void, StageError> removeWorkspace(Path path, RemoveOptions options);

    /**
     * Runs a git subcommand inside the workspace; a non-zero exit is an error.
     */
    Result<CommandResult, StageError> execInWorkspace(Path path, List<String> gitArgs);

    boolean hasUncommittedChanges(Path path);

    /**
     * Uncommitted changes in the workspace with their current contents.
     */
    List<FileChange> listChanges(Path path);
}
