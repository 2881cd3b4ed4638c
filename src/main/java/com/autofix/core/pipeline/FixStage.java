package com.autofix.core.pipeline;

import com.autofix.ai.AiAdapter;
import com.autofix.core.error.AiErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.FileChange;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.Workspace;
import com.autofix.core.result.Result;
import com.autofix.vcs.VersionControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Has the AI integration apply the analysed fix inside the workspace, then reads back
 * what actually changed on disk.
 */
public class FixStage implements PipelineStage<FixResult> {

    private static final Logger log = LoggerFactory.getLogger(FixStage.class);

    static final String NO_CHANGES_MESSAGE =
            "AI reported success but no files were actually modified in the worktree";

    private final AiAdapter aiAdapter;
    private final VersionControl versionControl;

    public FixStage(AiAdapter aiAdapter, VersionControl versionControl) {
        this.aiAdapter = aiAdapter;
        this.versionControl = versionControl;
    }

    @Override
    public String name() {
        return "fix";
    }

    @Override
    public Result<FixResult, StageError> execute(PipelineContext context) {
        if (context.workspace().isEmpty() || context.analysis().isEmpty()) {
            return Result.err(StageError.of(AiErrorCode.FIX_FAILED, "Fix requires a workspace and an analysis"));
        }
        Workspace workspace = context.workspace().get();
        AnalysisResult analysis = context.analysis().get();

        Result<FixResult, StageError> applied =
                aiAdapter.applyFix(context.group(), analysis, workspace.path(), context.feedback());
        if (applied.isErr()) {
            return applied;
        }
        FixResult reported = applied.value();
        if (!reported.success()) {
            return Result.err(StageError.of(AiErrorCode.FIX_FAILED,
                    "Fix tool reported failure: " + reported.summary()));
        }
        if (!verifyChanges(context)) {
            return Result.err(StageError.of(AiErrorCode.FIX_FAILED, NO_CHANGES_MESSAGE));
        }

        List<FileChange> changes = versionControl.listChanges(workspace.path());
        log.info("Fix touched {} file(s)", changes.size());
        return Result.ok(new FixResult(changes, reported.summary(), true, reported.commitMessage()));
    }

    /**
     * True when the workspace has uncommitted modifications.
     */
    public boolean verifyChanges(PipelineContext context) {
        return context.workspace()
                .map(ws -> versionControl.hasUncommittedChanges(ws.path()))
                .orElse(false);
    }
}
