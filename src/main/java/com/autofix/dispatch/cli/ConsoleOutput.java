package com.autofix.dispatch.cli;

import com.autofix.core.events.PipelineEvent;
import com.autofix.core.model.CheckRun;
import com.autofix.core.model.CheckStatus;
import com.autofix.core.model.GroupResult;
import com.autofix.core.queue.QueueEvent;
import com.autofix.core.queue.QueueEventType;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the autofix CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AUTOFIX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AUTOFIX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void checkRun(CheckRun run) {
        String status = switch (run.status()) {
            case PASSED -> "@|fg(green) PASS|@";
            case FAILED -> "@|fg(red) FAIL|@";
            case TIMEOUT -> "@|fg(red) TIMEOUT|@";
            case SKIPPED -> "@|fg(white) SKIP|@";
        };
        String line = "  @|fg(yellow) [" + run.check().scriptName().toUpperCase() + "]|@ " + status
                + " (" + run.durationMs() + "ms)";
        if (run.status() == CheckStatus.FAILED || run.status() == CheckStatus.TIMEOUT) {
            line += " " + run.firstErrorLine();
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    public static void queueEvent(QueueEvent event) {
        String prefix = switch (event.type()) {
            case ITEM_STARTED -> "@|fg(blue) [START]|@";
            case ITEM_COMPLETED -> "@|fg(green),bold [DONE]|@";
            case ITEM_FAILED -> "@|fg(red),bold [FAILED]|@";
            case ITEM_RETRYING -> "@|fg(yellow) [RETRY]|@";
            default -> null;
        };
        if (prefix == null) {
            return;
        }
        String text = prefix + " " + event.groupId() + " (attempt " + event.attempt() + ")";
        if (event.type() == QueueEventType.ITEM_COMPLETED && event.result() != null) {
            text += describe(event.result());
        } else if (event.error() != null) {
            text += " " + event.error();
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(text));
    }

    public static void pipelineEvent(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case "stage.started" -> "@|fg(white)   >|@";
            case "stage.completed" -> "@|fg(green)   +|@";
            case "stage.failed" -> "@|fg(red)   x|@";
            case "guardrail.rejected" -> "@|fg(red),bold   [GUARDRAIL]|@";
            case "state.changed" -> "@|fg(white)   ~|@";
            default -> "@|fg(white)   [" + event.eventType() + "]|@";
        };
        String stage = event.stage() == null ? "" : " " + event.stage();
        Object message = "state.changed".equals(event.eventType())
                ? event.payload().get("from") + " -> " + event.payload().get("to")
                : event.payload().get("message");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.groupId() + stage + (message != null ? ": " + message : "")));
    }

    private static String describe(GroupResult result) {
        if (result.dryRun()) {
            return " dry run";
        }
        return result.publishUrl() != null ? " " + result.publishUrl() : "";
    }
}
