package com.autofix.core.fix;

import com.autofix.ai.AiAdapter;
import com.autofix.checks.CheckRunner;
import com.autofix.checks.DependencyInstaller;
import com.autofix.core.budget.BudgetTracker;
import com.autofix.core.config.AutofixProperties;
import com.autofix.core.events.EventBus;
import com.autofix.core.guardrail.GuardrailEvaluator;
import com.autofix.core.interrupt.InterruptController;
import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.CheckType;
import com.autofix.core.model.Complexity;
import com.autofix.core.pipeline.AnalysisStage;
import com.autofix.core.pipeline.CheckStage;
import com.autofix.core.pipeline.CommitStage;
import com.autofix.core.pipeline.FixStage;
import com.autofix.core.pipeline.PublishStage;
import com.autofix.core.pipeline.WorkspaceStage;
import com.autofix.tracker.IssueTracker;
import com.autofix.vcs.VersionControl;
import com.autofix.vcs.WorktreeRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds an orchestrator for one run. Base branch, fix budget and dry-run can be
 * overridden per run; everything else comes from configuration.
 */
@Component
public class FixOrchestratorFactory {

    private final AutofixProperties properties;
    private final VersionControl versionControl;
    private final WorktreeRegistry registry;
    private final AiAdapter aiAdapter;
    private final CheckRunner checkRunner;
    private final DependencyInstaller installer;
    private final IssueTracker tracker;
    private final GuardrailEvaluator guardrails;
    private final InterruptController interrupts;
    private final EventBus eventBus;
    private final BudgetTracker budget;
    private final AutofixMetrics metrics;

    public FixOrchestratorFactory(AutofixProperties properties, VersionControl versionControl,
                                  WorktreeRegistry registry, AiAdapter aiAdapter, CheckRunner checkRunner,
                                  DependencyInstaller installer, IssueTracker tracker, GuardrailEvaluator guardrails,
                                  InterruptController interrupts, EventBus eventBus, BudgetTracker budget,
                                  @Autowired(required = false) AutofixMetrics metrics) {
        this.properties = properties;
        this.versionControl = versionControl;
        this.registry = registry;
        this.aiAdapter = aiAdapter;
        this.checkRunner = checkRunner;
        this.installer = installer;
        this.tracker = tracker;
        this.guardrails = guardrails;
        this.interrupts = interrupts;
        this.eventBus = eventBus;
        this.budget = budget;
        this.metrics = metrics;
    }

    public FixOrchestrator create(String baseBranch, int fixRetries, boolean dryRun) {
        return new FixOrchestrator(stages(baseBranch), guardrails, new RetryStrategy(), new FailureHandler(),
                interrupts, eventBus, budget, metrics, fixRetries, dryRun);
    }

    public FixOrchestrator create() {
        return create(properties.getWorktree().getBaseBranch(), properties.getFix().getMaxRetries(),
                properties.getPipeline().isDryRun());
    }

    public FixOrchestrator.FixStages stages(String baseBranch) {
        return new FixOrchestrator.FixStages(
                new WorkspaceStage(registry, versionControl, baseBranch),
                new AnalysisStage(aiAdapter, Complexity.valueOf(properties.getAi().getMaxComplexity().toUpperCase(Locale.ROOT))),
                new FixStage(aiAdapter, versionControl),
                checkStage(),
                new CommitStage(versionControl, new CommitMessageGenerator()),
                new PublishStage(tracker, baseBranch));
    }

    public CheckStage checkStage() {
        List<CheckType> order = properties.getChecks().getOrder().stream().map(CheckType::fromName).toList();
        return new CheckStage(checkRunner, installer, order, properties.getChecks().isFailFast());
    }
}
