package com.autofix.ai;

import com.autofix.core.error.StageError;
import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.result.Result;

import java.nio.file.Path;

/**
 * The external code-generation capability. Its reasoning is opaque to the pipeline.
 */
public interface AiAdapter {

    Result<AnalysisResult, StageError> analyzeGroup(IssueGroup group, Path workspace);

    /**
     * Applies a fix inside the workspace.
     *
     * @param feedback guidance from the previous failed attempt, or null on the first attempt
     */
    Result<FixResult, StageError> applyFix(IssueGroup group, AnalysisResult analysis, Path workspace, String feedback);
}
