package com.autofix.tracker;

import com.autofix.core.cache.TagCache;
import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.IssuePriority;
import com.autofix.core.model.IssueType;
import com.autofix.core.model.PublishRequest;
import com.autofix.core.process.CommandResult;
import com.autofix.core.process.ProcessExecutionException;
import com.autofix.core.process.ProcessRunner;
import com.autofix.core.result.Result;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * GitHub adapter built on the {@code gh} CLI. Responses are requested as JSON and read with Jackson.
 * <p>
 * Grouping heuristics are out of scope here: each fetched issue becomes its own group
 * on branch {@code fix/issue-<number>}.
 */
public class GhCliIssueTracker implements IssueTracker {

    private static final Logger log = LoggerFactory.getLogger(GhCliIssueTracker.class);

    static final String ISSUE_FIELDS = "number,title,body,labels,url";
    static final String IN_PROGRESS_LABEL = "autofix-in-progress";
    static final List<String> FAILURE_LABELS = List.of("needs-manual-fix", "automated-fix-failed");

    private final ProcessRunner processRunner;
    private final String executable;
    private final String repository;
    private final Path workDir;
    private final Duration timeout;
    private final TagCache tagCache;
    private final ObjectMapper objectMapper;

    public GhCliIssueTracker(ProcessRunner processRunner, String executable, String repository, Path workDir,
                             Duration timeout, TagCache tagCache, ObjectMapper objectMapper) {
        this.processRunner = processRunner;
        this.executable = executable;
        this.repository = repository == null ? "" : repository;
        this.workDir = workDir;
        this.timeout = timeout;
        this.tagCache = tagCache;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<IssueGroup> fetchIssues(IssueCriteria criteria) {
        List<Issue> issues = new ArrayList<>();
        if (!criteria.issueNumbers().isEmpty()) {
            for (int number : criteria.issueNumbers()) {
                JsonNode node = readJson(gh("issue", "view", String.valueOf(number), "--json", ISSUE_FIELDS));
                issues.add(toIssue(node));
            }
        } else {
            List<String> args = new ArrayList<>(List.of("issue", "list", "--state", "open",
                    "--json", ISSUE_FIELDS, "--limit", String.valueOf(criteria.limit())));
            for (String label : criteria.labels()) {
                args.add("--label");
                args.add(label);
            }
            readJson(gh(args.toArray(String[]::new))).forEach(node -> issues.add(toIssue(node)));
        }

        List<IssueGroup> groups = new ArrayList<>();
        for (Issue issue : issues) {
            boolean excluded = issue.labels().stream().anyMatch(criteria.excludeLabels()::contains);
            if (excluded) {
                log.debug("Skipping #{}: excluded by label", issue.number());
                continue;
            }
            groups.add(IssueGroup.of("issue-" + issue.number(), issue.title(),
                    "fix/issue-" + issue.number(), List.of(issue)));
        }
        log.info("Fetched {} issue group(s)", groups.size());
        return groups;
    }

    @Override
    public Result<PublishRequest, StageError> createPublishRequest(List<Issue> issues, String branch, String baseBranch) {
        String title = PublishRequestText.title(issues);
        String body = PublishRequestText.body(issues);
        try {
            CommandResult result = gh("pr", "create", "--base", baseBranch, "--head", branch,
                    "--title", title, "--body", body);
            if (result.exitCode() != 0) {
                return Result.err(StageError.of(OrchestratorErrorCode.PR_CREATION_FAILED,
                        "gh pr create failed: " + result.stderr().strip()));
            }
            String url = result.stdout().strip().lines().reduce((a, b) -> b).orElse("");
            return Result.ok(new PublishRequest(numberFromUrl(url), url, title, branch, baseBranch));
        } catch (ProcessExecutionException e) {
            return Result.err(StageError.of(OrchestratorErrorCode.PR_CREATION_FAILED, e.getMessage(), e));
        }
    }

    @Override
    public Result<Void, StageError> markIssueFixed(int issueNumber, PublishRequest request) {
        return run("issue", "comment", String.valueOf(issueNumber), "--body",
                "Automated fix submitted in " + request.url())
                .flatMap(ignored -> run("issue", "edit", String.valueOf(issueNumber),
                        "--remove-label", IN_PROGRESS_LABEL));
    }

    @Override
    public Result<Void, StageError> markIssueFailed(int issueNumber, String comment) {
        FAILURE_LABELS.forEach(this::ensureLabel);
        return run("issue", "edit", String.valueOf(issueNumber),
                "--add-label", String.join(",", FAILURE_LABELS), "--remove-label", IN_PROGRESS_LABEL)
                .flatMap(ignored -> run("issue", "comment", String.valueOf(issueNumber), "--body", comment));
    }

    @Override
    public Result<Void, StageError> markIssueInProgress(int issueNumber) {
        ensureLabel(IN_PROGRESS_LABEL);
        return run("issue", "edit", String.valueOf(issueNumber), "--add-label", IN_PROGRESS_LABEL);
    }

    /**
     * Creates the label unless the (cached) label list already has it.
     */
    void ensureLabel(String name) {
        String key = repository.isBlank() ? workDir.toString() : repository;
        Map<String, String> labels = tagCache.get(key).orElseGet(() -> {
            Map<String, String> fetched = new HashMap<>();
            readJson(gh("label", "list", "--json", "name", "--limit", "500"))
                    .forEach(n -> fetched.put(n.path("name").asText().toLowerCase(Locale.ROOT), n.path("name").asText()));
            tagCache.put(key, fetched);
            return fetched;
        });
        if (labels.containsKey(name.toLowerCase(Locale.ROOT))) {
            return;
        }
        CommandResult created = gh("label", "create", name, "--force");
        tagCache.invalidate(key);
        if (created.exitCode() != 0) {
            log.warn("Could not create label {}: {}", name, created.stderr().strip());
        }
    }

    Issue toIssue(JsonNode node) {
        List<String> labels = new ArrayList<>();
        node.path("labels").forEach(l -> labels.add(l.path("name").asText()));
        return new Issue(
                node.path("number").asInt(),
                node.path("title").asText(""),
                node.path("body").asText(""),
                typeFromLabels(labels),
                priorityFromLabels(labels),
                labels,
                componentFromLabels(labels),
                List.of(),
                node.path("url").asText(""));
    }

    static IssueType typeFromLabels(List<String> labels) {
        for (String label : labels) {
            String l = label.toLowerCase(Locale.ROOT).replace("type:", "").trim();
            for (IssueType type : IssueType.values()) {
                if (type.name().equalsIgnoreCase(l)) {
                    return type;
                }
            }
            if (l.equals("enhancement")) {
                return IssueType.FEATURE;
            }
            if (l.equals("documentation")) {
                return IssueType.DOCS;
            }
        }
        return IssueType.BUG;
    }

    static IssuePriority priorityFromLabels(List<String> labels) {
        for (String label : labels) {
            String l = label.toLowerCase(Locale.ROOT);
            if (l.equals("p0") || l.endsWith("critical")) return IssuePriority.CRITICAL;
            if (l.equals("p1") || l.endsWith("high")) return IssuePriority.HIGH;
            if (l.equals("p3") || l.endsWith("low")) return IssuePriority.LOW;
        }
        return IssuePriority.MEDIUM;
    }

    static String componentFromLabels(List<String> labels) {
        return labels.stream()
                .filter(l -> l.toLowerCase(Locale.ROOT).startsWith("component:"))
                .map(l -> l.substring("component:".length()).trim())
                .findFirst()
                .orElse("");
    }

    static int numberFromUrl(String url) {
        int slash = url.lastIndexOf('/');
        try {
            return Integer.parseInt(url.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private Result<Void, StageError> run(String... args) {
        try {
            CommandResult result = gh(args);
            if (result.exitCode() != 0) {
                return Result.err(StageError.of(OrchestratorErrorCode.UNKNOWN,
                        "gh " + args[0] + " " + args[1] + " failed: " + result.stderr().strip()));
            }
            return Result.ok(null);
        } catch (ProcessExecutionException e) {
            return Result.err(StageError.of(OrchestratorErrorCode.UNKNOWN, e.getMessage(), e));
        }
    }

    private JsonNode readJson(CommandResult result) {
        if (result.exitCode() != 0) {
            throw new IssueTrackerException("gh failed: " + result.stderr().strip());
        }
        try {
            return objectMapper.readTree(result.stdout());
        } catch (JsonProcessingException e) {
            throw new IssueTrackerException("Unexpected gh output", e);
        }
    }

    CommandResult gh(String... args) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(args));
        if (!repository.isBlank()) {
            command.add("--repo");
            command.add(repository);
        }
        log.debug("gh {}", List.of(args).stream().limit(3).collect(Collectors.joining(" ")));
        return processRunner.run(workDir, command, timeout);
    }
}
