package com.autofix.core.pipeline;

import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.fix.CommitMessageGenerator;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.Workspace;
import com.autofix.core.process.CommandResult;
import com.autofix.core.result.Result;
import com.autofix.vcs.VersionControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Commits everything in the workspace and pushes the branch to origin.
 * A push failure is reported separately from a commit failure.
 */
public class CommitStage implements PipelineStage<String> {

    private static final Logger log = LoggerFactory.getLogger(CommitStage.class);

    private final VersionControl versionControl;
    private final CommitMessageGenerator messageGenerator;

    public CommitStage(VersionControl versionControl, CommitMessageGenerator messageGenerator) {
        this.versionControl = versionControl;
        this.messageGenerator = messageGenerator;
    }

    @Override
    public String name() {
        return "commit";
    }

    /**
     * @return the commit message used
     */
    @Override
    public Result<String, StageError> execute(PipelineContext context) {
        if (context.workspace().isEmpty() || context.fixResult().isEmpty()) {
            return Result.err(StageError.of(OrchestratorErrorCode.COMMIT_FAILED,
                    "Commit requires a workspace and a fix result"));
        }
        Workspace workspace = context.workspace().get();
        FixResult fix = context.fixResult().get();
        String message = messageGenerator.generate(context.group(), fix);

        Result<CommandResult, StageError> staged = versionControl.execInWorkspace(workspace.path(), List.of("add", "-A"));
        if (staged.isErr()) {
            return Result.err(wrap(OrchestratorErrorCode.COMMIT_FAILED, staged.error()));
        }
        Result<CommandResult, StageError> committed =
                versionControl.execInWorkspace(workspace.path(), List.of("commit", "-m", message));
        if (committed.isErr()) {
            return Result.err(wrap(OrchestratorErrorCode.COMMIT_FAILED, committed.error()));
        }
        Result<CommandResult, StageError> pushed =
                versionControl.execInWorkspace(workspace.path(), List.of("push", "-u", "origin", workspace.branch()));
        if (pushed.isErr()) {
            return Result.err(wrap(OrchestratorErrorCode.PUSH_FAILED, pushed.error()));
        }
        log.info("Committed and pushed {}", workspace.branch());
        return Result.ok(message);
    }

    private static StageError wrap(OrchestratorErrorCode code, StageError cause) {
        return new StageError(code, cause.message(), cause.details(), cause.cause());
    }
}
