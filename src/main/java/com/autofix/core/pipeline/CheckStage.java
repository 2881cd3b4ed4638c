package com.autofix.core.pipeline;

import com.autofix.checks.CheckRunner;
import com.autofix.checks.DependencyInstaller;
import com.autofix.checks.InstallPlan;
import com.autofix.core.error.CheckErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.CheckResult;
import com.autofix.core.model.CheckRun;
import com.autofix.core.model.CheckType;
import com.autofix.core.model.Workspace;
import com.autofix.core.result.Result;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Installs dependencies and runs the verification checks in the workspace.
 * <p>
 * Returns the {@link CheckResult} whether or not the checks passed; the caller
 * decides what a failing result means. Only an install failure or a missing
 * workspace is a stage error.
 */
public class CheckStage implements PipelineStage<CheckResult> {

    private static final int DETAIL_LIMIT = 500;

    private final CheckRunner checkRunner;
    private final DependencyInstaller installer;
    private final List<CheckType> order;
    private final boolean failFast;

    public CheckStage(CheckRunner checkRunner, DependencyInstaller installer, List<CheckType> order, boolean failFast) {
        this.checkRunner = checkRunner;
        this.installer = installer;
        this.order = List.copyOf(order);
        this.failFast = failFast;
    }

    @Override
    public String name() {
        return "check";
    }

    @Override
    public Result<CheckResult, StageError> execute(PipelineContext context) {
        if (context.workspace().isEmpty()) {
            return Result.err(StageError.of(CheckErrorCode.INVALID_STATE, "No workspace to run checks in"));
        }
        Workspace workspace = context.workspace().get();
        return run(workspace.path(), context.fixAttempt());
    }

    /**
     * Runs install and checks against an arbitrary directory.
     */
    public Result<CheckResult, StageError> run(Path dir, int attempt) {
        Result<InstallPlan, StageError> installed = installer.install(dir);
        if (installed.isErr()) {
            return Result.err(installed.error());
        }
        CheckResult result = checkRunner.runChecks(dir, order, failFast);
        return Result.ok(new CheckResult(result.success(), result.results(), attempt, result.totalDurationMs()));
    }

    /**
     * Error describing a failing check result, with details capped at 500 characters.
     */
    public static StageError failureError(CheckResult result) {
        List<CheckRun> failed = result.failedChecks();
        String names = failed.stream().map(r -> r.check().scriptName()).collect(Collectors.joining(", "));
        String details = failed.stream()
                .map(r -> r.check().scriptName() + ": " + r.firstErrorLine())
                .collect(Collectors.joining("; "));
        if (details.length() > DETAIL_LIMIT) {
            details = details.substring(0, DETAIL_LIMIT);
        }
        return new StageError(CheckErrorCode.CHECKS_FAILED, "Checks failed: " + names + " (" + details + ")",
                Map.of("failedChecks", names), null);
    }
}
