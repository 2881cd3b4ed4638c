package com.autofix.dispatch.cli;

import com.autofix.core.config.AutofixProperties;
import com.autofix.core.events.EventBus;
import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.fix.FixOrchestrator;
import com.autofix.core.fix.FixOrchestratorFactory;
import com.autofix.core.interrupt.InterruptController;
import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.GroupResult;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.queue.ProcessingQueue;
import com.autofix.core.queue.QueueEventType;
import com.autofix.core.report.ReportFormat;
import com.autofix.core.report.ReportGenerator;
import com.autofix.tracker.GroupsFileReader;
import com.autofix.tracker.IssueCriteria;
import com.autofix.tracker.IssueTracker;
import com.autofix.vcs.WorktreeRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: autofix run
 * <p>
 * Fetches (or loads) issue groups, processes them through the queue and prints a report.
 * Exits 1 when any group failed. A termination signal exits 130 after cleanup.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Fix issue groups and open pull requests")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final Duration DRAIN_TIMEOUT = Duration.ofMinutes(5);

    @Option(names = "--groups-file", description = "JSON file with pre-built issue groups")
    Path groupsFile;

    @Option(names = "--issues", split = ",", description = "Issue numbers to fix")
    List<Integer> issues = new ArrayList<>();

    @Option(names = "--labels", split = ",", description = "Only issues carrying these labels")
    List<String> labels = new ArrayList<>();

    @Option(names = "--exclude-labels", split = ",", description = "Skip issues carrying these labels")
    List<String> excludeLabels = new ArrayList<>();

    @Option(names = "--limit", description = "Maximum issues to fetch (default: ${DEFAULT-VALUE})", defaultValue = "30")
    int limit;

    @Option(names = "--max-parallel", description = "Groups processed concurrently")
    Integer maxParallel;

    @Option(names = "--max-retries", description = "Queue-level retries per group")
    Integer maxRetries;

    @Option(names = "--base-branch", description = "Branch to cut fix branches from and target requests at")
    String baseBranch;

    @Option(names = "--dry-run", description = "Analyse and check without fixing, committing or publishing")
    boolean dryRun;

    @Option(names = "--report-format", description = "text, json or markdown (default: ${DEFAULT-VALUE})",
            defaultValue = "text")
    String reportFormat;

    @Option(names = {"--verbose", "-v"}, description = "Print stage-level progress")
    boolean verbose;

    private final AutofixProperties properties;
    private final IssueTracker tracker;
    private final FixOrchestratorFactory orchestratorFactory;
    private final InterruptController interrupts;
    private final WorktreeRegistry registry;
    private final EventBus eventBus;
    private final ReportGenerator reportGenerator;
    private final ObjectMapper objectMapper;
    private final AutofixMetrics metrics;

    public RunCommand(AutofixProperties properties, IssueTracker tracker, FixOrchestratorFactory orchestratorFactory,
                      InterruptController interrupts, WorktreeRegistry registry, EventBus eventBus,
                      ReportGenerator reportGenerator, ObjectMapper objectMapper,
                      @Autowired(required = false) AutofixMetrics metrics) {
        this.properties = properties;
        this.tracker = tracker;
        this.orchestratorFactory = orchestratorFactory;
        this.interrupts = interrupts;
        this.registry = registry;
        this.eventBus = eventBus;
        this.reportGenerator = reportGenerator;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ReportFormat format;
        try {
            format = ReportFormat.fromString(reportFormat);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        int parallel = maxParallel != null ? maxParallel : properties.getQueue().getMaxConcurrency();
        int worktreeLimit = properties.getWorktree().getMaxConcurrent();
        if (parallel < 1 || parallel > worktreeLimit) {
            ConsoleOutput.error("--max-parallel must be between 1 and worktree.max-concurrent (" + worktreeLimit
                    + "), got " + parallel);
            return 2;
        }

        List<IssueGroup> groups;
        try {
            groups = loadGroups();
        } catch (RuntimeException e) {
            ConsoleOutput.error("Could not load issue groups: " + e.getMessage());
            return 1;
        }
        if (groups.isEmpty()) {
            ConsoleOutput.info("No issue groups to process.");
            return 0;
        }

        int retries = maxRetries != null ? maxRetries : properties.getQueue().getMaxRetries();
        String base = baseBranch != null ? baseBranch : properties.getWorktree().getBaseBranch();
        boolean dry = dryRun || properties.getPipeline().isDryRun();
        ConsoleOutput.info(String.format("Processing %d group(s): parallel=%d, retries=%d, base=%s%s",
                groups.size(), parallel, retries, base, dry ? ", dry run" : ""));

        FixOrchestrator orchestrator = orchestratorFactory.create(base, properties.getFix().getMaxRetries(), dry);
        ProcessingQueue queue = new ProcessingQueue(parallel, retries, interrupts, metrics);
        queue.setProcessor(orchestrator);
        queue.on(ConsoleOutput::queueEvent);
        queue.on(event -> {
            if (event.type() == QueueEventType.ITEM_FAILED && event.result() != null
                    && !OrchestratorErrorCode.INTERRUPTED.name().equals(event.result().errorCode())) {
                orchestrator.reportFailure(event.result());
            }
        });
        // guardrail rejections are always shown; stage-level progress only with --verbose
        EventBus.Subscription progress = eventBus.subscribe(
                verbose ? event -> true : EventBus.types("guardrail.rejected"), ConsoleOutput::pipelineEvent);

        interrupts.init();
        interrupts.onCleanup(() -> {
            queue.stop();
            if (!queue.awaitIdle(DRAIN_TIMEOUT)) {
                log.warn("In-flight groups still running after {}s", DRAIN_TIMEOUT.toSeconds());
            }
        });
        interrupts.onCleanup(registry::releaseAll);

        Instant started = Instant.now();
        List<GroupResult> results;
        try {
            queue.enqueue(groups);
            results = queue.start();
        } finally {
            progress.unsubscribe();
            interrupts.reset();
        }

        System.out.println();
        System.out.println(reportGenerator.render(
                reportGenerator.build(results, Duration.between(started, Instant.now())), format));

        boolean anyFailed = results.stream().anyMatch(r -> !r.isCompleted());
        if (anyFailed) {
            ConsoleOutput.error("Some groups failed.");
            return 1;
        }
        ConsoleOutput.success("All groups completed.");
        return 0;
    }

    List<IssueGroup> loadGroups() {
        if (groupsFile != null) {
            return new GroupsFileReader(objectMapper).read(groupsFile);
        }
        return tracker.fetchIssues(new IssueCriteria(issues, labels, excludeLabels, limit));
    }
}
