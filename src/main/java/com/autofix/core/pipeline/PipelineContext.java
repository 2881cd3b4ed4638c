package com.autofix.core.pipeline;

import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.CheckResult;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.PublishRequest;
import com.autofix.core.model.Workspace;

import java.util.Optional;

/**
 * Mutable state threaded through the stages of one group attempt.
 * <p>
 * Owned by a single worker thread; never shared between in-flight groups. The workspace is the
 * exception: interrupt cleanup may take it from the signal thread.
 */
public class PipelineContext {

    private final IssueGroup group;
    private final int queueAttempt;

    private Workspace workspace;
    private AnalysisResult analysis;
    private FixResult fixResult;
    private CheckResult checkResult;
    private PublishRequest publishRequest;
    private String feedback;
    private int fixAttempt;
    private FixState state = FixState.PENDING;

    public PipelineContext(IssueGroup group, int queueAttempt) {
        this.group = group;
        this.queueAttempt = queueAttempt;
    }

    public IssueGroup group() { return group; }
    public int queueAttempt() { return queueAttempt; }

    public synchronized Optional<Workspace> workspace() { return Optional.ofNullable(workspace); }
    public synchronized void setWorkspace(Workspace workspace) { this.workspace = workspace; }

    /**
     * Clears and returns the workspace, so exactly one caller gets to release it.
     */
    public synchronized Optional<Workspace> takeWorkspace() {
        Optional<Workspace> taken = Optional.ofNullable(workspace);
        workspace = null;
        return taken;
    }

    public Optional<AnalysisResult> analysis() { return Optional.ofNullable(analysis); }
    public void setAnalysis(AnalysisResult analysis) { this.analysis = analysis; }

    public Optional<FixResult> fixResult() { return Optional.ofNullable(fixResult); }
    public void setFixResult(FixResult fixResult) { this.fixResult = fixResult; }

    public Optional<CheckResult> checkResult() { return Optional.ofNullable(checkResult); }
    public void setCheckResult(CheckResult checkResult) { this.checkResult = checkResult; }

    public Optional<PublishRequest> publishRequest() { return Optional.ofNullable(publishRequest); }
    public void setPublishRequest(PublishRequest publishRequest) { this.publishRequest = publishRequest; }

    /** Guidance derived from the previous failed fix attempt, null on the first one. */
    public String feedback() { return feedback; }
    public void setFeedback(String feedback) { this.feedback = feedback; }

    public int fixAttempt() { return fixAttempt; }
    public void setFixAttempt(int fixAttempt) { this.fixAttempt = fixAttempt; }

    /** Where the orchestrator's state machine currently is for this attempt. */
    public FixState state() { return state; }
    public void setState(FixState state) { this.state = state; }
}
