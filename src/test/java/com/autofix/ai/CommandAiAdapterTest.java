package com.autofix.ai;

import com.autofix.core.budget.BudgetTracker;
import com.autofix.core.error.AiErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.Complexity;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.IssuePriority;
import com.autofix.core.model.IssueType;
import com.autofix.core.process.CommandNotFoundException;
import com.autofix.core.process.CommandResult;
import com.autofix.core.process.ProcessRunner;
import com.autofix.core.result.Result;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandAiAdapterTest {

    private static final Path WORKTREE = Path.of("/tmp/wt/fix-issue-3");
    private static final List<String> COMMAND = List.of("claude", "-p", "--output-format", "json");
    private static final String COSTED_ANSWER = "{\"type\":\"result\",\"is_error\":false,\"total_cost_usd\":0.35,"
            + "\"result\":\"{\\\"rootCause\\\":\\\"missing guard\\\"}\"}";

    @Mock private ProcessRunner processRunner;

    private CommandAiAdapter adapter;
    private IssueGroup group;

    @BeforeEach
    void setUp() {
        adapter = new CommandAiAdapter(processRunner, COMMAND, Duration.ofMinutes(5), new ObjectMapper(),
                BudgetTracker.unlimited());
        group = IssueGroup.of("issue-3", "Null check", "fix/issue-3", List.of(new Issue(3, "NPE in parser",
                "Crashes on empty input", IssueType.BUG, IssuePriority.HIGH, List.of(), "", List.of("src/parser.ts"), "")));
    }

    private void respond(int exitCode, String stdout, String stderr) {
        when(processRunner.run(eq(WORKTREE), eq(COMMAND), anyMap(), anyString(), any(Duration.class)))
                .thenReturn(new CommandResult(exitCode, stdout, stderr, 10, false));
    }

    // -- analysis ------------------------------------------------------------

    @Nested
    @DisplayName("analyzeGroup")
    class Analyze {

        @Test
        @DisplayName("sends the issues on stdin and parses a wrapped answer")
        void parsesWrappedResult() {
            respond(0, "{\"type\":\"result\",\"is_error\":false,\"result\":\"Here you go:\\n"
                    + "{\\\"rootCause\\\":\\\"missing guard\\\",\\\"suggestedFix\\\":\\\"add guard\\\","
                    + "\\\"filesToModify\\\":[\\\"src/parser.ts\\\"],\\\"confidence\\\":0.9}\"}", "");

            Result<AnalysisResult, StageError> result = adapter.analyzeGroup(group, WORKTREE);

            assertTrue(result.isOk(), () -> result.error().toString());
            assertEquals("missing guard", result.value().rootCause());
            assertEquals(List.of("src/parser.ts"), result.value().filesToModify());
            assertEquals(0.9, result.value().confidence());
            assertEquals(List.of(3), result.value().issueNumbers());

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(processRunner).run(eq(WORKTREE), eq(COMMAND), anyMap(), prompt.capture(), any(Duration.class));
            assertTrue(prompt.getValue().contains("## #3 NPE in parser [bug]"));
            assertTrue(prompt.getValue().contains("Do not modify any files."));
        }

        @Test
        void rejectsAnswerWithoutDiagnosis() {
            respond(0, "{\"confidence\":0.2}", "");

            assertEquals(AiErrorCode.PARSE_ERROR, adapter.analyzeGroup(group, WORKTREE).error().code());
        }

        @Test
        void garbageIsAParseError() {
            respond(0, "I could not decide", "");

            assertEquals(AiErrorCode.PARSE_ERROR, adapter.analyzeGroup(group, WORKTREE).error().code());
        }

        @Test
        void toolReportedErrorIsClassified() {
            respond(0, "{\"is_error\":true,\"result\":\"API Error: 429 rate limit exceeded\"}", "");

            assertEquals(AiErrorCode.RATE_LIMIT, adapter.analyzeGroup(group, WORKTREE).error().code());
        }
    }

    // -- fix -----------------------------------------------------------------

    @Nested
    @DisplayName("applyFix")
    class Apply {

        private final AnalysisResult analysis = new AnalysisResult(List.of(3), List.of("src/parser.ts"),
                "missing guard", "add guard", 0.9, Complexity.LOW);

        @Test
        void feedbackIsIncludedAndSuccessDefaultsToTrue() {
            respond(0, "{\"summary\":\"guarded\",\"commitMessage\":\"fix(parser): guard empty input\"}", "");

            Result<FixResult, StageError> result = adapter.applyFix(group, analysis, WORKTREE, "Attempt 1 failed.");

            assertTrue(result.value().success());
            assertEquals("guarded", result.value().summary());
            assertTrue(result.value().changes().isEmpty());
            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(processRunner).run(any(), anyList(), anyMap(), prompt.capture(), any());
            assertTrue(prompt.getValue().contains("The previous attempt failed verification:\nAttempt 1 failed."));
            assertTrue(prompt.getValue().contains("Files: src/parser.ts"));
        }

        @Test
        void nonZeroExitUsesStderr() {
            respond(1, "", "Prompt is too long: context window too large");

            Result<FixResult, StageError> result = adapter.applyFix(group, analysis, WORKTREE, null);

            assertEquals(AiErrorCode.CONTEXT_TOO_LARGE, result.error().code());
        }

        @Test
        void timeout() {
            when(processRunner.run(any(), anyList(), anyMap(), anyString(), any()))
                    .thenReturn(new CommandResult(-1, "", "", 300_000, true));

            assertEquals(AiErrorCode.TIMEOUT, adapter.applyFix(group, analysis, WORKTREE, null).error().code());
        }

        @Test
        void missingToolIsNotRetryable() {
            when(processRunner.run(any(), anyList(), anyMap(), anyString(), any()))
                    .thenThrow(new CommandNotFoundException("claude", new IOException("error=2")));

            StageError error = adapter.applyFix(group, analysis, WORKTREE, null).error();

            assertEquals(AiErrorCode.TOOL_NOT_FOUND, error.code());
            assertFalse(error.retryable());
        }
    }

    // -- budget --------------------------------------------------------------

    @Nested
    @DisplayName("budget")
    class Budget {

        private BudgetTracker budget;

        @BeforeEach
        void limited() {
            budget = new BudgetTracker(new BigDecimal("0.50"), new BigDecimal("5"), "opus", "sonnet");
            adapter = new CommandAiAdapter(processRunner, COMMAND, Duration.ofMinutes(5), new ObjectMapper(), budget);
        }

        @SuppressWarnings("unchecked")
        private List<String> lastCommand() {
            ArgumentCaptor<List<String>> argv = ArgumentCaptor.forClass(List.class);
            verify(processRunner, atLeastOnce()).run(any(), argv.capture(), anyMap(), anyString(), any());
            return argv.getValue();
        }

        @Test
        @DisplayName("the remaining limit and model are passed to the tool")
        void passesLimitAndModel() {
            when(processRunner.run(any(), anyList(), anyMap(), anyString(), any()))
                    .thenReturn(new CommandResult(0, COSTED_ANSWER, "", 10, false));

            assertTrue(adapter.analyzeGroup(group, WORKTREE).isOk());

            assertEquals(List.of("claude", "-p", "--output-format", "json", "--max-budget-usd", "0.5",
                    "--model", "opus"), lastCommand());
        }

        @Test
        @DisplayName("reported cost is charged to the group and the session")
        void recordsReportedCost() {
            when(processRunner.run(any(), anyList(), anyMap(), anyString(), any()))
                    .thenReturn(new CommandResult(0, COSTED_ANSWER, "", 10, false));

            adapter.analyzeGroup(group, WORKTREE);
            adapter.analyzeGroup(group, WORKTREE);

            assertEquals(new BigDecimal("0.70"), budget.spentOn(group));
            assertEquals(new BigDecimal("0.70"), budget.sessionSpend());
        }

        @Test
        @DisplayName("the next call after the group limit is reached fails without running the tool")
        void refusesOnceExhausted() {
            when(processRunner.run(any(), anyList(), anyMap(), anyString(), any()))
                    .thenReturn(new CommandResult(0, COSTED_ANSWER, "", 10, false));
            adapter.analyzeGroup(group, WORKTREE);
            adapter.analyzeGroup(group, WORKTREE);

            StageError error = adapter.analyzeGroup(group, WORKTREE).error();

            assertEquals(AiErrorCode.BUDGET_EXCEEDED, error.code());
            assertFalse(error.retryable());
            verify(processRunner, times(2)).run(any(), anyList(), anyMap(), anyString(), any());
        }

        @Test
        @DisplayName("close to the limit the fallback model and a smaller cap are requested")
        void fallsBackNearTheLimit() {
            budget.record(group, new BigDecimal("0.42"));
            when(processRunner.run(any(), anyList(), anyMap(), anyString(), any()))
                    .thenReturn(new CommandResult(0, COSTED_ANSWER, "", 10, false));

            adapter.analyzeGroup(group, WORKTREE);

            List<String> argv = lastCommand();
            assertEquals("0.08", argv.get(argv.indexOf("--max-budget-usd") + 1));
            assertEquals("sonnet", argv.get(argv.indexOf("--model") + 1));
        }

        @Test
        void costIsRecordedEvenWhenTheToolFails() {
            when(processRunner.run(any(), anyList(), anyMap(), anyString(), any()))
                    .thenReturn(new CommandResult(1, "{\"is_error\":true,\"total_cost_usd\":0.2,\"result\":\"x\"}",
                            "crashed", 10, false));

            adapter.analyzeGroup(group, WORKTREE);

            assertEquals(new BigDecimal("0.2"), budget.spentOn(group));
        }
    }

    // -- helpers -------------------------------------------------------------

    @Test
    void classifyFallsBackToTheStageCode() {
        assertEquals(AiErrorCode.BUDGET_EXCEEDED, CommandAiAdapter.classify("Credit balance is too low", AiErrorCode.FIX_FAILED));
        assertEquals(AiErrorCode.API_ERROR, CommandAiAdapter.classify("503 overloaded", AiErrorCode.FIX_FAILED));
        assertEquals(AiErrorCode.FIX_FAILED, CommandAiAdapter.classify("segfault", AiErrorCode.FIX_FAILED));
        assertEquals(AiErrorCode.FIX_FAILED, CommandAiAdapter.classify(null, AiErrorCode.FIX_FAILED));
    }

    @Test
    @DisplayName("numbers and words inside ordinary output do not pick an error class")
    void classifyIgnoresIncidentalMatches() {
        assertEquals(AiErrorCode.FIX_FAILED, CommandAiAdapter.classify(
                "TypeError: x is undefined\n    at parse (src/parser.ts:429:12)", AiErrorCode.FIX_FAILED));
        assertEquals(AiErrorCode.FIX_FAILED, CommandAiAdapter.classify(
                "Could not update src/budget.ts: budgetLimit is not exported", AiErrorCode.FIX_FAILED));
        assertEquals(AiErrorCode.FIX_FAILED, CommandAiAdapter.classify(
                "request id 4290311 failed", AiErrorCode.FIX_FAILED));
    }

    @Test
    void classifyMatchesStatusCodesNextToAStatusWord() {
        assertEquals(AiErrorCode.RATE_LIMIT, CommandAiAdapter.classify("HTTP 429 Too Many Requests", AiErrorCode.FIX_FAILED));
        assertEquals(AiErrorCode.API_ERROR, CommandAiAdapter.classify("upstream returned status: 502", AiErrorCode.FIX_FAILED));
        assertEquals(AiErrorCode.BUDGET_EXCEEDED, CommandAiAdapter.classify("Exceeded max budget of $0.50", AiErrorCode.FIX_FAILED));
    }

    @Test
    @DisplayName("a budget subtype wins over the free-text message")
    void structuredSubtypeIsPreferred() {
        respond(0, "{\"type\":\"result\",\"subtype\":\"error_max_budget_usd\",\"is_error\":true,"
                + "\"result\":\"stopped\"}", "");

        assertEquals(AiErrorCode.BUDGET_EXCEEDED, adapter.analyzeGroup(group, WORKTREE).error().code());
    }

    @Test
    void extractObjectFindsOutermostBraces() {
        assertEquals("{\"a\":{\"b\":1}}", CommandAiAdapter.extractObject("text {\"a\":{\"b\":1}} trailing"));
        assertEquals("no braces", CommandAiAdapter.extractObject("no braces"));
    }
}
