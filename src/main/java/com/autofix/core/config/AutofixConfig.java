package com.autofix.core.config;

import com.autofix.ai.AiAdapter;
import com.autofix.ai.CommandAiAdapter;
import com.autofix.checks.CheckRunner;
import com.autofix.checks.DependencyInstaller;
import com.autofix.checks.ProcessCheckRunner;
import com.autofix.core.budget.BudgetTracker;
import com.autofix.core.cache.TagCache;
import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.CheckType;
import com.autofix.core.process.ProcessRunner;
import com.autofix.core.report.ReportGenerator;
import com.autofix.core.retry.Backoff;
import com.autofix.tracker.GhCliIssueTracker;
import com.autofix.tracker.IssueTracker;
import com.autofix.vcs.GitWorktreeManager;
import com.autofix.vcs.VersionControl;
import com.autofix.vcs.WorktreeRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Adapter wiring. Every external tool is driven through the shared {@link ProcessRunner}.
 */
@Configuration
public class AutofixConfig {

    /** Used when no monitoring backend contributes a registry. */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public ProcessRunner processRunner(AutofixProperties properties) {
        return new ProcessRunner(properties.getChecks().getKillGracePeriod());
    }

    @Bean
    public Backoff backoff() {
        return new Backoff();
    }

    @Bean
    public TagCache tagCache(AutofixProperties properties) {
        return new TagCache(properties.getTracker().getTagCacheTtl());
    }

    @Bean
    public VersionControl versionControl(AutofixProperties properties, ProcessRunner processRunner) {
        AutofixProperties.Worktree wt = properties.getWorktree();
        return new GitWorktreeManager(Path.of(wt.getRepoPath()), Path.of(wt.getBaseDir()), wt.getPrefix(), processRunner);
    }

    /**
     * Tracks worktrees held by in-flight groups and enforces the concurrency ceiling.
     */
    @Bean
    public WorktreeRegistry worktreeRegistry(VersionControl versionControl, AutofixProperties properties,
                                             @Autowired(required = false) AutofixMetrics metrics) {
        return new WorktreeRegistry(versionControl, properties.getWorktree().getMaxConcurrent(), metrics);
    }

    @Bean
    public CheckRunner checkRunner(ProcessRunner processRunner, Backoff backoff, ObjectMapper objectMapper,
                                   AutofixProperties properties,
                                   @Autowired(required = false) AutofixMetrics metrics) {
        AutofixProperties.Checks checks = properties.getChecks();
        Map<CheckType, Duration> timeouts = Map.of(
                CheckType.LINT, checks.getLintTimeout(),
                CheckType.TYPECHECK, checks.getTypecheckTimeout(),
                CheckType.TEST, checks.getTestTimeout());
        return new ProcessCheckRunner(processRunner, backoff, timeouts, checks.getCommandRetries(), objectMapper, metrics);
    }

    @Bean
    public DependencyInstaller dependencyInstaller(ProcessRunner processRunner, AutofixProperties properties) {
        return new DependencyInstaller(processRunner, properties.getChecks().getInstallTimeout());
    }

    @Bean
    public BudgetTracker budgetTracker(AutofixProperties properties) {
        AutofixProperties.Ai ai = properties.getAi();
        return new BudgetTracker(ai.getMaxBudgetPerIssue(), ai.getMaxBudgetPerSession(), ai.getModel(),
                ai.getFallbackModel());
    }

    @Bean
    public AiAdapter aiAdapter(ProcessRunner processRunner, ObjectMapper objectMapper, BudgetTracker budgetTracker,
                               AutofixProperties properties) {
        return new CommandAiAdapter(processRunner, properties.getAi().getCommand(), properties.getAi().getTimeout(),
                objectMapper, budgetTracker);
    }

    @Bean
    public IssueTracker issueTracker(ProcessRunner processRunner, TagCache tagCache, ObjectMapper objectMapper,
                                     AutofixProperties properties) {
        AutofixProperties.Tracker tracker = properties.getTracker();
        return new GhCliIssueTracker(processRunner, tracker.getCommand(), tracker.getRepository(),
                Path.of(properties.getWorktree().getRepoPath()), tracker.getTimeout(), tagCache, objectMapper);
    }

    @Bean
    public ReportGenerator reportGenerator() {
        return new ReportGenerator();
    }
}
