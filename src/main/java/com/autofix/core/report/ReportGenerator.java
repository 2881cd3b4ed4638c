package com.autofix.core.report;

import com.autofix.core.model.GroupResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Renders run results as plain text, JSON or Markdown.
 */
public class ReportGenerator {

    private final ObjectMapper objectMapper;

    public ReportGenerator() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ReportGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RunReport build(List<GroupResult> results, Duration elapsed) {
        int completed = (int) results.stream().filter(GroupResult::isCompleted).count();
        int failed = results.size() - completed;
        double rate = results.isEmpty() ? 0.0 : (double) completed / results.size();
        List<RunReport.GroupEntry> entries = results.stream()
                .map(r -> new RunReport.GroupEntry(
                        r.group().id(),
                        r.group().name(),
                        r.group().issueNumbers(),
                        r.status().name().toLowerCase(Locale.ROOT),
                        r.attempts(),
                        r.duration().toMillis(),
                        r.publishUrl(),
                        r.errorCode(),
                        r.error(),
                        r.dryRun()))
                .toList();
        return new RunReport(Instant.now(), results.size(), completed, failed, rate, elapsed.toMillis(), entries);
    }

    public String render(RunReport report, ReportFormat format) {
        return switch (format) {
            case TEXT -> text(report);
            case JSON -> json(report);
            case MARKDOWN -> markdown(report);
        };
    }

    private String json(RunReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }

    private static String text(RunReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Autofix run: ").append(report.completed()).append('/').append(report.totalGroups())
          .append(" group(s) completed, ").append(report.failed()).append(" failed (")
          .append(percent(report.successRate())).append(") in ").append(formatDuration(report.durationMs()))
          .append('\n');
        for (RunReport.GroupEntry g : report.groups()) {
            sb.append(String.format("  %-9s %-24s attempts=%d %s%n",
                    g.status().toUpperCase(Locale.ROOT), g.groupId(), g.attempts(), detail(g)));
        }
        return sb.toString();
    }

    private static String markdown(RunReport report) {
        StringBuilder sb = new StringBuilder("# Autofix Report\n\n");
        sb.append("| Metric | Value |\n|---|---|\n");
        sb.append("| Groups | ").append(report.totalGroups()).append(" |\n");
        sb.append("| Completed | ").append(report.completed()).append(" |\n");
        sb.append("| Failed | ").append(report.failed()).append(" |\n");
        sb.append("| Success rate | ").append(percent(report.successRate())).append(" |\n");
        sb.append("| Duration | ").append(formatDuration(report.durationMs())).append(" |\n\n");
        sb.append("## Groups\n\n| Group | Issues | Status | Attempts | Result |\n|---|---|---|---|---|\n");
        for (RunReport.GroupEntry g : report.groups()) {
            sb.append("| ").append(g.groupId())
              .append(" | ").append(g.issues().stream().map(n -> "#" + n).reduce((a, b) -> a + ", " + b).orElse(""))
              .append(" | ").append(g.status())
              .append(" | ").append(g.attempts())
              .append(" | ").append(detail(g).replace("|", "\\|"))
              .append(" |\n");
        }
        return sb.toString();
    }

    private static String detail(RunReport.GroupEntry g) {
        if (g.dryRun()) {
            return "dry run";
        }
        if (g.publishUrl() != null) {
            return g.publishUrl();
        }
        if (g.error() != null) {
            return (g.errorCode() != null ? g.errorCode() + ": " : "") + g.error();
        }
        return "";
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.0f%%", rate * 100);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
