package com.autofix.core.pipeline;

import com.autofix.ai.AiAdapter;
import com.autofix.core.error.AiErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.Complexity;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.Workspace;
import com.autofix.core.result.Result;

import java.util.Optional;

/**
 * Asks the AI integration to diagnose the group. Requires a workspace.
 */
public class AnalysisStage implements PipelineStage<AnalysisResult> {

    private final AiAdapter aiAdapter;
    private final Complexity maxComplexity;

    public AnalysisStage(AiAdapter aiAdapter, Complexity maxComplexity) {
        this.aiAdapter = aiAdapter;
        this.maxComplexity = maxComplexity;
    }

    @Override
    public String name() {
        return "analysis";
    }

    @Override
    public Result<AnalysisResult, StageError> execute(PipelineContext context) {
        Optional<Workspace> workspace = context.workspace();
        if (workspace.isEmpty()) {
            return Result.err(StageError.of(AiErrorCode.ANALYSIS_FAILED, "No workspace available for analysis"));
        }
        return aiAdapter.analyzeGroup(context.group(), workspace.get().path());
    }

    /**
     * Whether the group is worth sending to the AI integration at all.
     */
    public boolean canHandle(IssueGroup group) {
        if (group.issues().isEmpty()) {
            return false;
        }
        return estimateComplexity(group).ordinal() <= maxComplexity.ordinal();
    }

    public Complexity estimateComplexity(IssueGroup group) {
        int issues = group.issues().size();
        int files = group.relatedFiles().size();
        if (issues == 1 && files <= 2) {
            return Complexity.LOW;
        }
        if (issues > 3 || files > 5) {
            return Complexity.HIGH;
        }
        return Complexity.MEDIUM;
    }

    public String suggestedApproach(IssueGroup group) {
        return switch (estimateComplexity(group)) {
            case LOW -> "Direct fix: make a focused change in the affected file.";
            case MEDIUM -> "Incremental fix: address each issue in turn and verify between changes.";
            case HIGH -> "Careful fix: study the affected components first and keep each change minimal.";
        };
    }
}
