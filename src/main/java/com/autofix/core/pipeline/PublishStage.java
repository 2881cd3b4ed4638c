package com.autofix.core.pipeline;

import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.Issue;
import com.autofix.core.model.PublishRequest;
import com.autofix.core.model.Workspace;
import com.autofix.core.result.Result;
import com.autofix.tracker.IssueTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the pull request for the group and marks its issues fixed.
 */
public class PublishStage implements PipelineStage<PublishRequest> {

    private static final Logger log = LoggerFactory.getLogger(PublishStage.class);

    private final IssueTracker tracker;
    private final String baseBranch;

    public PublishStage(IssueTracker tracker, String baseBranch) {
        this.tracker = tracker;
        this.baseBranch = baseBranch;
    }

    @Override
    public String name() {
        return "publish";
    }

    @Override
    public Result<PublishRequest, StageError> execute(PipelineContext context) {
        if (context.workspace().isEmpty()) {
            return Result.err(StageError.of(OrchestratorErrorCode.PR_CREATION_FAILED, "No workspace branch to publish"));
        }
        Workspace workspace = context.workspace().get();
        Result<PublishRequest, StageError> created =
                tracker.createPublishRequest(context.group().issues(), workspace.branch(), baseBranch);
        if (created.isErr()) {
            StageError e = created.error();
            return Result.err(new StageError(OrchestratorErrorCode.PR_CREATION_FAILED, e.message(), e.details(), e.cause()));
        }
        PublishRequest request = created.value();
        log.info("Opened request #{} {}", request.number(), request.url());
        updateIssues(context, request);
        return created;
    }

    /**
     * Marks each linked issue fixed. Individual failures are logged, not propagated.
     */
    void updateIssues(PipelineContext context, PublishRequest request) {
        for (Issue issue : context.group().issues()) {
            Result<Void, StageError> marked = tracker.markIssueFixed(issue.number(), request);
            if (marked.isErr()) {
                log.warn("Could not mark #{} fixed: {}", issue.number(), marked.error());
            }
        }
    }

    public Result<Void, StageError> markIssueFailed(int issueNumber, String comment) {
        return tracker.markIssueFailed(issueNumber, comment);
    }

    public Result<Void, StageError> markIssueInProgress(int issueNumber) {
        return tracker.markIssueInProgress(issueNumber);
    }
}
