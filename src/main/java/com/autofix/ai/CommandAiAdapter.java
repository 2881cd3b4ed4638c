package com.autofix.ai;

import com.autofix.core.budget.BudgetTracker;
import com.autofix.core.error.AiErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.Complexity;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.process.CommandNotFoundException;
import com.autofix.core.process.CommandResult;
import com.autofix.core.process.ProcessExecutionException;
import com.autofix.core.process.ProcessRunner;
import com.autofix.core.result.Result;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Drives an external code-generation CLI: the prompt goes to stdin, a JSON object is
 * expected on stdout. Tools that wrap their answer as {@code {"result": "..."}} are unwrapped.
 * <p>
 * Each call is charged to the {@link BudgetTracker}: the remaining budget is passed as
 * {@code --max-budget-usd}, and the cost the tool reports is recorded against the group.
 */
public class CommandAiAdapter implements AiAdapter {

    private static final Logger log = LoggerFactory.getLogger(CommandAiAdapter.class);

    private static final Pattern RATE_LIMIT = Pattern.compile(
            "\\brate[ _-]?limit(ed)?\\b|\\btoo many requests\\b|\\b(status|http|error)\\W{0,3}429\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTEXT_TOO_LARGE = Pattern.compile(
            "\\b(prompt|context|input)\\b[^.\\n]{0,40}\\btoo (long|large)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BUDGET = Pattern.compile(
            "\\b(max(imum)?[ _-]?budget|budget (exceeded|exhausted|limit reached))\\b|\\bcredit balance is too low\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern API_ERROR = Pattern.compile(
            "\\bapi error\\b|\\boverloaded(_error)?\\b|\\b(status|http|error)\\W{0,3}5\\d\\d\\b",
            Pattern.CASE_INSENSITIVE);

    private final ProcessRunner processRunner;
    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final BudgetTracker budget;

    public CommandAiAdapter(ProcessRunner processRunner, List<String> command, Duration timeout,
                            ObjectMapper objectMapper, BudgetTracker budget) {
        this.processRunner = processRunner;
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.budget = budget;
    }

    @Override
    public Result<AnalysisResult, StageError> analyzeGroup(IssueGroup group, Path workspace) {
        return invoke(group, PromptBuilder.analysis(group), workspace, AiErrorCode.ANALYSIS_FAILED)
                .flatMap(json -> {
                    List<String> files = new ArrayList<>();
                    json.path("filesToModify").forEach(n -> files.add(n.asText()));
                    if (!json.hasNonNull("rootCause") && !json.hasNonNull("suggestedFix")) {
                        return Result.err(StageError.of(AiErrorCode.PARSE_ERROR,
                                "Analysis response has neither rootCause nor suggestedFix"));
                    }
                    return Result.ok(new AnalysisResult(
                            group.issueNumbers(),
                            files,
                            json.path("rootCause").asText(""),
                            json.path("suggestedFix").asText(""),
                            json.path("confidence").asDouble(0.5),
                            Complexity.MEDIUM));
                });
    }

    @Override
    public Result<FixResult, StageError> applyFix(IssueGroup group, AnalysisResult analysis, Path workspace,
                                                  String feedback) {
        return invoke(group, PromptBuilder.fix(group, analysis, feedback), workspace, AiErrorCode.FIX_FAILED)
                .map(json -> new FixResult(
                        List.of(),
                        json.path("summary").asText(""),
                        !json.path("success").isBoolean() || json.path("success").asBoolean(),
                        json.path("commitMessage").asText("")));
    }

    private Result<JsonNode, StageError> invoke(IssueGroup group, String prompt, Path workspace,
                                                AiErrorCode failureCode) {
        Optional<StageError> exhausted = budget.checkAvailable(group);
        if (exhausted.isPresent()) {
            return Result.err(exhausted.get());
        }
        CommandResult result;
        try {
            result = processRunner.run(workspace, commandFor(group), Map.of(), prompt, timeout);
        } catch (CommandNotFoundException e) {
            return Result.err(StageError.of(AiErrorCode.TOOL_NOT_FOUND,
                    "AI tool not found: " + e.executable(), e));
        } catch (ProcessExecutionException e) {
            return Result.err(StageError.of(failureCode, e.getMessage(), e));
        }

        if (result.timedOut()) {
            return Result.err(StageError.of(AiErrorCode.TIMEOUT,
                    "AI tool timed out after " + timeout.toSeconds() + "s"));
        }
        budget.record(group, reportedCost(result.stdout()));
        if (result.exitCode() != 0) {
            String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            return Result.err(StageError.of(classify(detail, failureCode), detail.strip()));
        }
        return parse(result.stdout());
    }

    List<String> commandFor(IssueGroup group) {
        List<String> argv = new ArrayList<>(command);
        budget.remaining(group).ifPresent(limit ->
                argv.addAll(List.of("--max-budget-usd", limit.setScale(4, RoundingMode.DOWN).stripTrailingZeros().toPlainString())));
        budget.model(group).ifPresent(model -> argv.addAll(List.of("--model", model)));
        return argv;
    }

    /**
     * USD cost from the tool's result envelope ({@code total_cost_usd}, {@code cost_usd} or
     * {@code usage.cost_usd}); null when the output carries none.
     */
    BigDecimal reportedCost(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(stdout.strip());
            if (node == null || !node.isObject()) {
                return null;
            }
            for (JsonNode cost : List.of(node.path("total_cost_usd"), node.path("cost_usd"),
                    node.path("usage").path("cost_usd"))) {
                if (cost.isNumber()) {
                    return cost.decimalValue();
                }
            }
            return null;
        } catch (JsonProcessingException e) {
            log.debug("No cost in non-JSON tool output: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Maps tool error output onto the error taxonomy. Status codes count only next to
     * "status", "http" or "error", so line numbers and ids in a stack trace do not match.
     */
    static AiErrorCode classify(String output, AiErrorCode fallback) {
        String text = output == null ? "" : output;
        if (RATE_LIMIT.matcher(text).find()) {
            return AiErrorCode.RATE_LIMIT;
        }
        if (CONTEXT_TOO_LARGE.matcher(text).find()) {
            return AiErrorCode.CONTEXT_TOO_LARGE;
        }
        if (BUDGET.matcher(text).find()) {
            return AiErrorCode.BUDGET_EXCEEDED;
        }
        if (API_ERROR.matcher(text).find()) {
            return AiErrorCode.API_ERROR;
        }
        return fallback;
    }

    /**
     * Classifies a result the tool flagged as an error, preferring its {@code subtype} field.
     */
    static AiErrorCode classifyResult(JsonNode node, AiErrorCode fallback) {
        String subtype = node.path("subtype").asText("");
        if (subtype.startsWith("error_max_budget")) {
            return AiErrorCode.BUDGET_EXCEEDED;
        }
        return classify(node.path("result").asText(""), fallback);
    }

    Result<JsonNode, StageError> parse(String stdout) {
        try {
            JsonNode node = objectMapper.readTree(stdout.strip());
            if (node != null && node.path("result").isTextual()) {
                if (node.path("is_error").asBoolean(false)) {
                    String message = node.path("result").asText();
                    return Result.err(StageError.of(classifyResult(node, AiErrorCode.API_ERROR), message));
                }
                node = objectMapper.readTree(extractObject(node.path("result").asText()));
            }
            if (node == null || !node.isObject()) {
                return Result.err(StageError.of(AiErrorCode.PARSE_ERROR, "AI response is not a JSON object"));
            }
            return Result.ok(node);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable AI response: {}", stdout);
            return Result.err(StageError.of(AiErrorCode.PARSE_ERROR, "Could not parse AI response: "
                    + e.getOriginalMessage(), e));
        }
    }

    /**
     * The outermost {...} span of free text, or the text itself.
     */
    static String extractObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? text.substring(start, end + 1) : text;
    }
}
