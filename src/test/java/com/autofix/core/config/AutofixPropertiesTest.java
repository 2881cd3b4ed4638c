package com.autofix.core.config;

import com.autofix.ai.AiAdapter;
import com.autofix.checks.CheckRunner;
import com.autofix.core.budget.BudgetTracker;
import com.autofix.tracker.IssueTracker;
import com.autofix.vcs.WorktreeRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AutofixPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(AutofixProperties.class)
    static class PropertiesOnly {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesOnly.class);

    @Test
    void defaultsAreReasonable() {
        var props = new AutofixProperties();
        assertEquals(3, props.getQueue().getMaxConcurrency());
        assertEquals(2, props.getQueue().getMaxRetries());
        assertEquals(3, props.getFix().getMaxRetries());
        assertEquals(List.of("lint", "typecheck", "test"), props.getChecks().getOrder());
        assertTrue(props.getChecks().isFailFast());
        assertEquals(20, props.getGuardrails().getMaxFilesPerFix());
        assertEquals(5, props.getGuardrails().getMaxDirectoriesPerFix());
        assertEquals(Duration.ofMinutes(10), props.getTracker().getTagCacheTtl());
        assertEquals("gh", props.getTracker().getCommand());
        assertFalse(props.getPipeline().isDryRun());
    }

    @Test
    void bindsRelaxedNames() {
        runner.withPropertyValues(
                        "autofix.queue.max-concurrency=5",
                        "autofix.checks.test-timeout=45s",
                        "autofix.guardrails.forbidden-patterns[0]=console\\.log",
                        "autofix.ai.command=my-tool,--json")
                .run(context -> {
                    AutofixProperties props = context.getBean(AutofixProperties.class);
                    assertEquals(5, props.getQueue().getMaxConcurrency());
                    assertEquals(Duration.ofSeconds(45), props.getChecks().getTestTimeout());
                    assertEquals(List.of("console\\.log"), props.getGuardrails().getForbiddenPatterns());
                    assertEquals(List.of("my-tool", "--json"), props.getAi().getCommand());
                });
    }

    @Test
    void rejectsUnknownKeys() {
        runner.withPropertyValues("autofix.queue.max-paralel=4")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void rejectsInvalidValues() {
        runner.withPropertyValues("autofix.queue.max-concurrency=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void rejectsQueueWiderThanWorktreeCeiling() {
        runner.withPropertyValues("autofix.queue.max-concurrency=6")
                .run(context -> assertNotNull(context.getStartupFailure()));
        runner.withPropertyValues("autofix.queue.max-concurrency=6", "autofix.worktree.max-concurrent=6")
                .run(context -> assertNull(context.getStartupFailure()));
    }

    @Test
    void budgetLimitsBindAsUsdAmounts() {
        runner.withPropertyValues("autofix.ai.max-budget-per-issue=1.50", "autofix.ai.max-budget-per-session=20",
                        "autofix.ai.model=opus", "autofix.ai.fallback-model=sonnet")
                .run(context -> {
                    AutofixProperties.Ai ai = context.getBean(AutofixProperties.class).getAi();
                    assertEquals(new BigDecimal("1.50"), ai.getMaxBudgetPerIssue());
                    assertEquals(new BigDecimal("20"), ai.getMaxBudgetPerSession());
                    assertEquals("sonnet", ai.getFallbackModel());
                });
        runner.withPropertyValues("autofix.ai.max-budget-per-issue=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void budgetsAreUnlimitedByDefault() {
        runner.run(context -> {
            AutofixProperties.Ai ai = context.getBean(AutofixProperties.class).getAi();
            assertNull(ai.getMaxBudgetPerIssue());
            assertNull(ai.getMaxBudgetPerSession());
        });
    }

    @Test
    void adapterWiringStartsWithoutExternalTools() {
        runner.withUserConfiguration(AutofixConfig.class)
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .withPropertyValues("autofix.tracker.repository=acme/app")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertNotNull(context.getBean(MeterRegistry.class));
                    assertNotNull(context.getBean(WorktreeRegistry.class));
                    assertNotNull(context.getBean(CheckRunner.class));
                    assertNotNull(context.getBean(AiAdapter.class));
                    assertNotNull(context.getBean(BudgetTracker.class));
                    assertNotNull(context.getBean(IssueTracker.class));
                });
    }
}
