package com.autofix.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed configuration for the whole pipeline, bound once at startup.
 * Unknown keys and constraint violations fail the application context.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "autofix", ignoreUnknownFields = false)
public class AutofixProperties {

    @Valid
    private Queue queue = new Queue();
    @Valid
    private Fix fix = new Fix();
    @Valid
    private Checks checks = new Checks();
    @Valid
    private Guardrails guardrails = new Guardrails();
    @Valid
    private Worktree worktree = new Worktree();
    @Valid
    private Tracker tracker = new Tracker();
    @Valid
    private Ai ai = new Ai();
    private Pipeline pipeline = new Pipeline();

    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }
    public Fix getFix() { return fix; }
    public void setFix(Fix fix) { this.fix = fix; }
    public Checks getChecks() { return checks; }
    public void setChecks(Checks checks) { this.checks = checks; }
    public Guardrails getGuardrails() { return guardrails; }
    public void setGuardrails(Guardrails guardrails) { this.guardrails = guardrails; }
    public Worktree getWorktree() { return worktree; }
    public void setWorktree(Worktree worktree) { this.worktree = worktree; }
    public Tracker getTracker() { return tracker; }
    public void setTracker(Tracker tracker) { this.tracker = tracker; }
    public Ai getAi() { return ai; }
    public void setAi(Ai ai) { this.ai = ai; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }

    /**
     * Every admitted group holds a worktree, so the queue may not be wider than the worktree ceiling.
     */
    @AssertTrue(message = "autofix.queue.max-concurrency must not exceed autofix.worktree.max-concurrent")
    public boolean isQueueWithinWorktreeLimit() {
        return queue.getMaxConcurrency() <= worktree.getMaxConcurrent();
    }

    // -- Sections --

    public static class Queue {
        @Min(1)
        private int maxConcurrency = 3;
        /** Requeues per group after its first attempt, independent of {@link Fix#maxRetries}. */
        @Min(0)
        private int maxRetries = 2;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Fix {
        /** Fix/check iterations inside one group attempt. */
        @Min(1)
        private int maxRetries = 3;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Checks {
        @NotEmpty
        private List<String> order = new ArrayList<>(List.of("lint", "typecheck", "test"));
        private boolean failFast = true;
        @Min(0)
        private int commandRetries = 0;
        private Duration lintTimeout = Duration.ofSeconds(60);
        private Duration typecheckTimeout = Duration.ofSeconds(120);
        private Duration testTimeout = Duration.ofSeconds(300);
        private Duration installTimeout = Duration.ofMinutes(5);
        private Duration killGracePeriod = Duration.ofSeconds(5);

        public List<String> getOrder() { return order; }
        public void setOrder(List<String> order) { this.order = order; }
        public boolean isFailFast() { return failFast; }
        public void setFailFast(boolean failFast) { this.failFast = failFast; }
        public int getCommandRetries() { return commandRetries; }
        public void setCommandRetries(int commandRetries) { this.commandRetries = commandRetries; }
        public Duration getLintTimeout() { return lintTimeout; }
        public void setLintTimeout(Duration lintTimeout) { this.lintTimeout = lintTimeout; }
        public Duration getTypecheckTimeout() { return typecheckTimeout; }
        public void setTypecheckTimeout(Duration typecheckTimeout) { this.typecheckTimeout = typecheckTimeout; }
        public Duration getTestTimeout() { return testTimeout; }
        public void setTestTimeout(Duration testTimeout) { this.testTimeout = testTimeout; }
        public Duration getInstallTimeout() { return installTimeout; }
        public void setInstallTimeout(Duration installTimeout) { this.installTimeout = installTimeout; }
        public Duration getKillGracePeriod() { return killGracePeriod; }
        public void setKillGracePeriod(Duration killGracePeriod) { this.killGracePeriod = killGracePeriod; }
    }

    public static class Guardrails {
        private List<String> forbiddenPatterns = new ArrayList<>();
        private List<String> allowedScopes = new ArrayList<>();
        @Min(1)
        private int maxFilesPerFix = 20;
        @Min(1)
        private int maxDirectoriesPerFix = 5;

        public List<String> getForbiddenPatterns() { return forbiddenPatterns; }
        public void setForbiddenPatterns(List<String> forbiddenPatterns) { this.forbiddenPatterns = forbiddenPatterns; }
        public List<String> getAllowedScopes() { return allowedScopes; }
        public void setAllowedScopes(List<String> allowedScopes) { this.allowedScopes = allowedScopes; }
        public int getMaxFilesPerFix() { return maxFilesPerFix; }
        public void setMaxFilesPerFix(int maxFilesPerFix) { this.maxFilesPerFix = maxFilesPerFix; }
        public int getMaxDirectoriesPerFix() { return maxDirectoriesPerFix; }
        public void setMaxDirectoriesPerFix(int maxDirectoriesPerFix) { this.maxDirectoriesPerFix = maxDirectoriesPerFix; }
    }

    public static class Worktree {
        @NotBlank
        private String repoPath = ".";
        @NotBlank
        private String baseDir = ".worktrees";
        private String prefix = "autofix-";
        @NotBlank
        private String baseBranch = "autofixing";
        @Min(1)
        private int maxConcurrent = 5;

        public String getRepoPath() { return repoPath; }
        public void setRepoPath(String repoPath) { this.repoPath = repoPath; }
        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
    }

    public static class Tracker {
        /** owner/repo; blank means the repository inferred by the CLI from the working directory. */
        private String repository = "";
        @NotBlank
        private String command = "gh";
        private Duration tagCacheTtl = Duration.ofMinutes(10);
        private Duration timeout = Duration.ofSeconds(60);

        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public Duration getTagCacheTtl() { return tagCacheTtl; }
        public void setTagCacheTtl(Duration tagCacheTtl) { this.tagCacheTtl = tagCacheTtl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Ai {
        /** argv of the external code-generation tool; the prompt is written to its stdin. */
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("claude", "-p", "--output-format", "json"));
        private Duration timeout = Duration.ofMinutes(10);
        /** Groups estimated above this complexity are skipped by the analysis pre-check. */
        private String maxComplexity = "HIGH";
        /** USD limit per group attempt; unset means unlimited. */
        @Positive
        private BigDecimal maxBudgetPerIssue;
        /** USD limit for the whole run; unset means unlimited. */
        @Positive
        private BigDecimal maxBudgetPerSession;
        /** Passed as {@code --model} when set. */
        private String model;
        /** Used instead of {@link #model} once 80% of a budget is spent. */
        private String fallbackModel;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public String getMaxComplexity() { return maxComplexity; }
        public void setMaxComplexity(String maxComplexity) { this.maxComplexity = maxComplexity; }
        public BigDecimal getMaxBudgetPerIssue() { return maxBudgetPerIssue; }
        public void setMaxBudgetPerIssue(BigDecimal maxBudgetPerIssue) { this.maxBudgetPerIssue = maxBudgetPerIssue; }
        public BigDecimal getMaxBudgetPerSession() { return maxBudgetPerSession; }
        public void setMaxBudgetPerSession(BigDecimal maxBudgetPerSession) { this.maxBudgetPerSession = maxBudgetPerSession; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getFallbackModel() { return fallbackModel; }
        public void setFallbackModel(String fallbackModel) { this.fallbackModel = fallbackModel; }
    }

    public static class Pipeline {
        private boolean dryRun = false;

        public boolean isDryRun() { return dryRun; }
        public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
    }
}
