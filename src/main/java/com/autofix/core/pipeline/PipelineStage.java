package com.autofix.core.pipeline;

import com.autofix.core.error.StageError;
import com.autofix.core.result.Result;

/**
 * One step of the fix pipeline. Stages never call each other; the orchestrator composes them.
 *
 * @param <T> value produced on success
 */
public interface PipelineStage<T> {

    /** Name used for event tagging and MDC. */
    String name();

    Result<T, StageError> execute(PipelineContext context);
}
