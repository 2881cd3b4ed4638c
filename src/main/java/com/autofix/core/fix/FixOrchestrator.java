package com.autofix.core.fix;

import com.autofix.core.budget.BudgetTracker;
import com.autofix.core.error.ErrorCode;
import com.autofix.core.error.GuardrailErrorCode;
import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.events.EventBus;
import com.autofix.core.events.PipelineEvent;
import com.autofix.core.guardrail.GuardrailEvaluator;
import com.autofix.core.guardrail.ScopeAnalysis;
import com.autofix.core.interrupt.InterruptController;
import com.autofix.core.logging.MdcContext;
import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.CheckResult;
import com.autofix.core.model.FailureSummary;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.GroupResult;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.PublishRequest;
import com.autofix.core.model.Workspace;
import com.autofix.core.pipeline.AnalysisStage;
import com.autofix.core.pipeline.CheckStage;
import com.autofix.core.pipeline.CommitStage;
import com.autofix.core.pipeline.FixStage;
import com.autofix.core.pipeline.FixState;
import com.autofix.core.pipeline.PipelineContext;
import com.autofix.core.pipeline.PipelineStage;
import com.autofix.core.pipeline.PublishStage;
import com.autofix.core.pipeline.WorkspaceStage;
import com.autofix.core.queue.GroupProcessor;
import com.autofix.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one group through the stages with a bounded fix/check loop.
 *
 * <pre>
 *   PENDING -> ANALYZING -> FIXING -> VALIDATING -> CHECKING -> PUBLISHED
 *                             ^                         |
 *                             +--------- RETRY ---------+--> FAILED
 * </pre>
 *
 * <p>Guardrail rejections end the group at once and the Check stage never runs.
 * Check failures loop back with feedback while {@link RetryStrategy#shouldRetry} allows it.
 * The workspace is released on every exit path; the branch survives only on success.
 *
 * <p>In dry-run mode the Fix, Commit and Publish stages and all issue updates are skipped.
 */
public class FixOrchestrator implements GroupProcessor {

    private static final Logger log = LoggerFactory.getLogger(FixOrchestrator.class);

    private final FixStages stages;
    private final GuardrailEvaluator guardrails;
    private final RetryStrategy retryStrategy;
    private final FailureHandler failureHandler;
    private final InterruptController interrupts;
    private final EventBus eventBus;
    private final BudgetTracker budget;
    private final AutofixMetrics metrics;
    private final int maxRetries;
    private final boolean dryRun;

    public FixOrchestrator(FixStages stages, GuardrailEvaluator guardrails, RetryStrategy retryStrategy,
                           FailureHandler failureHandler, InterruptController interrupts, EventBus eventBus,
                           BudgetTracker budget, AutofixMetrics metrics, int maxRetries, boolean dryRun) {
        this.stages = stages;
        this.guardrails = guardrails;
        this.retryStrategy = retryStrategy;
        this.failureHandler = failureHandler;
        this.interrupts = interrupts;
        this.eventBus = eventBus;
        this.budget = budget;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
        this.dryRun = dryRun;
    }

    @Override
    public GroupResult process(IssueGroup group, int attempt) {
        Instant startedAt = Instant.now();
        PipelineContext context = new PipelineContext(group, attempt);
        MdcContext.setGroup(group.id(), attempt);
        GroupResult result = null;
        try {
            // a shutdown mid-attempt removes the worktree and its branch
            result = interrupts.withCleanup(() -> stages.workspace().cleanup(context, false),
                    () -> attempt(context, startedAt));
            return result;
        } finally {
            stages.workspace().cleanup(context, result != null && result.isCompleted());
            budget.release(group);
            MdcContext.clear();
        }
    }

    private GroupResult attempt(PipelineContext context, Instant startedAt) {
        IssueGroup group = context.group();
        log.info("Processing group {} ({} issue(s)), attempt {}", group.id(), group.issues().size(),
                context.queueAttempt());
        publish("group.started", group, null, Map.of("attempt", context.queueAttempt(), "dryRun", dryRun));

        if (interrupts.isInterrupted()) {
            return fail(context, StageError.of(OrchestratorErrorCode.INTERRUPTED, "Interrupted before start"),
                    0, startedAt);
        }
        if (!stages.analysis().canHandle(group)) {
            return fail(context, StageError.of(GuardrailErrorCode.SCOPE_TOO_BROAD,
                    "Group is too complex to fix automatically (" + stages.analysis().estimateComplexity(group) + ")"),
                    0, startedAt);
        }
        if (!dryRun) {
            markInProgress(group);
        }

        // ── Workspace ────────────────────────────────────────────
        Result<Workspace, StageError> workspace = runStage(stages.workspace(), context);
        if (workspace.isErr()) {
            return fail(context, workspace.error(), 0, startedAt);
        }
        context.setWorkspace(workspace.value());

        // ── Analysis ─────────────────────────────────────────────
        transition(context, FixState.ANALYZING);
        Result<AnalysisResult, StageError> analysis = runStage(stages.analysis(), context);
        if (analysis.isErr()) {
            return fail(context, analysis.error(), 0, startedAt);
        }
        context.setAnalysis(analysis.value());

        if (dryRun) {
            return dryRunChecks(context, startedAt);
        }
        return fixLoop(context, startedAt);
    }

    /**
     * Posts the failure summary carried by a result the queue has given up on and marks its issues failed.
     */
    public void reportFailure(GroupResult result) {
        if (dryRun) {
            return;
        }
        FailureSummary summary = result.failure();
        if (summary == null) {
            summary = new FailureSummary(result.error() == null ? "Unknown failure" : result.error(),
                    result.attempts(), List.of(), List.of("Review the issue manually."));
        }
        String comment = failureHandler.formatComment(summary);
        for (Issue issue : result.group().issues()) {
            Result<Void, StageError> marked = stages.publish().markIssueFailed(issue.number(), comment);
            if (marked.isErr()) {
                log.warn("Could not mark #{} failed: {}", issue.number(), marked.error());
            }
        }
    }

    // -- fix/check loop ------------------------------------------------------

    private GroupResult fixLoop(PipelineContext context, Instant startedAt) {
        IssueGroup group = context.group();
        List<FixAttempt> attempts = new ArrayList<>();

        for (int iteration = 1; iteration <= maxRetries; iteration++) {
            if (interrupts.isInterrupted()) {
                return fail(context, StageError.of(OrchestratorErrorCode.INTERRUPTED,
                        "Interrupted before fix iteration " + iteration), iteration - 1, startedAt);
            }
            context.setFixAttempt(iteration);
            publish("fix.attempt", group, null, Map.of("iteration", iteration));

            transition(context, FixState.FIXING);
            Result<FixResult, StageError> fix = runStage(stages.fix(), context);
            if (fix.isErr()) {
                return fail(context, fix.error(), iteration, startedAt);
            }
            context.setFixResult(fix.value());

            transition(context, FixState.VALIDATING);
            Result<ScopeAnalysis, StageError> guard = guardrails.evaluate(fix.value().changes());
            if (guard.isErr()) {
                if (metrics != null) {
                    metrics.recordGuardrailViolation(guard.error().code().name());
                }
                publish("guardrail.rejected", group, null,
                        Map.of("code", guard.error().code().name(), "message", guard.error().message()));
                return fail(context, guard.error(), iteration, startedAt);
            }

            transition(context, FixState.CHECKING);
            Result<CheckResult, StageError> checks = runStage(stages.check(), context);
            if (checks.isErr()) {
                return fail(context, checks.error(), iteration, startedAt);
            }
            CheckResult checkResult = checks.value();
            context.setCheckResult(checkResult);

            FixAttempt fixAttempt = new FixAttempt(iteration, fix.value().changes(), checkResult,
                    checkResult.success(), Instant.now());
            attempts.add(fixAttempt);

            if (checkResult.success()) {
                recordAttempts(iteration);
                return publishFix(context, iteration, startedAt);
            }
            if (!retryStrategy.shouldRetry(fixAttempt, iteration, maxRetries)) {
                break;
            }
            transition(context, FixState.RETRY);
            context.setFeedback(retryStrategy.generateFeedback(iteration, checkResult));
            log.info("Checks failed on iteration {}, retrying with feedback", iteration);
        }

        recordAttempts(attempts.size());
        FailureSummary summary = failureHandler.summarize(group, attempts);
        StageError error = attempts.size() >= maxRetries
                ? StageError.of(OrchestratorErrorCode.MAX_RETRIES_EXCEEDED, summary.reason())
                : CheckStage.failureError(attempts.get(attempts.size() - 1).checkResult());
        return terminal(context, error, summary, startedAt);
    }

    private GroupResult publishFix(PipelineContext context, int iterations, Instant startedAt) {
        Result<String, StageError> committed = runStage(stages.commit(), context);
        if (committed.isErr()) {
            return fail(context, committed.error(), iterations, startedAt);
        }
        Result<PublishRequest, StageError> published = runStage(stages.publish(), context);
        if (published.isErr()) {
            return fail(context, published.error(), iterations, startedAt);
        }
        context.setPublishRequest(published.value());
        transition(context, FixState.PUBLISHED);
        publish("group.completed", context.group(), null, Map.of("url", published.value().url()));
        return GroupResult.completed(context.group(), context.queueAttempt(), startedAt, published.value().url(), false);
    }

    private GroupResult dryRunChecks(PipelineContext context, Instant startedAt) {
        context.setFixAttempt(1);
        transition(context, FixState.CHECKING);
        Result<CheckResult, StageError> checks = runStage(stages.check(), context);
        if (checks.isErr()) {
            return fail(context, checks.error(), 0, startedAt);
        }
        log.info("Dry run for {}: checks {} (fix, commit and publish skipped)",
                context.group().id(), checks.value().success() ? "pass" : "fail");
        publish("group.completed", context.group(), null, Map.of("dryRun", true));
        return GroupResult.completed(context.group(), context.queueAttempt(), startedAt, null, true);
    }

    // -- helpers -------------------------------------------------------------

    private <T> Result<T, StageError> runStage(PipelineStage<T> stage, PipelineContext context) {
        String groupId = context.group().id();
        MdcContext.setStage(stage.name());
        eventBus.publish(PipelineEvent.of("stage.started", groupId, stage.name(), Map.of()));
        Result<T, StageError> result;
        try {
            result = stage.execute(context);
        } catch (RuntimeException e) {
            log.error("Stage {} threw: {}", stage.name(), e.getMessage(), e);
            result = Result.err(StageError.of(OrchestratorErrorCode.UNKNOWN,
                    stage.name() + " stage failed: " + e.getMessage(), e));
        }
        if (result.isOk()) {
            eventBus.publish(PipelineEvent.of("stage.completed", groupId, stage.name(), Map.of()));
        } else {
            Map<String, Object> payload = new HashMap<>();
            payload.put("code", result.error().code().name());
            payload.put("message", result.error().message());
            eventBus.publish(PipelineEvent.of("stage.failed", groupId, stage.name(), payload));
        }
        MdcContext.clearStage();
        return result;
    }

    /**
     * Failed result for a stage error. Whether the queue may retry it follows the error code.
     */
    private GroupResult fail(PipelineContext context, StageError error, int iterations, Instant startedAt) {
        return terminal(context, error, failureHandler.summarize(context.group(), error, iterations), startedAt);
    }

    private GroupResult terminal(PipelineContext context, StageError error, FailureSummary summary,
                                 Instant startedAt) {
        transition(context, FixState.FAILED);
        ErrorCode code = error.code();
        log.warn("Group {} failed: {}", context.group().id(), error);
        Map<String, Object> payload = new HashMap<>();
        payload.put("code", code.name());
        payload.put("message", error.message());
        publish("group.failed", context.group(), null, payload);
        return GroupResult.failed(context.group(), error.message(), code.name(), code.retryable(),
                context.queueAttempt(), startedAt, summary);
    }

    private void transition(PipelineContext context, FixState state) {
        FixState previous = context.state();
        context.setState(state);
        log.debug("Group {} {} -> {}", context.group().id(), previous, state);
        publish("state.changed", context.group(), null, Map.of("from", previous.name(), "to", state.name()));
    }

    private void markInProgress(IssueGroup group) {
        for (Issue issue : group.issues()) {
            Result<Void, StageError> marked = stages.publish().markIssueInProgress(issue.number());
            if (marked.isErr()) {
                log.warn("Could not mark #{} in progress: {}", issue.number(), marked.error());
            }
        }
    }

    private void recordAttempts(int iterations) {
        if (metrics != null) {
            metrics.recordFixAttempts(iterations);
        }
    }

    private void publish(String type, IssueGroup group, String stage, Map<String, Object> payload) {
        eventBus.publish(PipelineEvent.of(type, group.id(), stage, payload));
    }

    /**
     * The stage set composed by the orchestrator.
     */
    public record FixStages(
        WorkspaceStage workspace,
        AnalysisStage analysis,
        FixStage fix,
        CheckStage check,
        CommitStage commit,
        PublishStage publish
    ) {}
}
