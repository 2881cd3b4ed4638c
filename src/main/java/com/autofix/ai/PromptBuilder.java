package com.autofix.ai;

import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;

/**
 * Plain-text prompts for the external tool.
 */
final class PromptBuilder {

    private PromptBuilder() {}

    static String analysis(IssueGroup group) {
        var sb = new StringBuilder();
        sb.append("Analyze the following issues in this repository and propose a fix strategy.\n");
        sb.append("Do not modify any files.\n\n");
        appendIssues(sb, group);
        sb.append("\nRespond with a single JSON object with the fields ")
                .append("\"rootCause\" (string), \"suggestedFix\" (string), ")
                .append("\"filesToModify\" (array of repository-relative paths), ")
                .append("\"confidence\" (number between 0 and 1).\n");
        return sb.toString();
    }

    static String fix(IssueGroup group, AnalysisResult analysis, String feedback) {
        var sb = new StringBuilder();
        sb.append("Fix the following issues by editing files in the current directory.\n");
        sb.append("Do not commit. Keep the change minimal.\n\n");
        appendIssues(sb, group);
        sb.append("\nRoot cause: ").append(analysis.rootCause()).append('\n');
        sb.append("Strategy: ").append(analysis.suggestedFix()).append('\n');
        if (!analysis.filesToModify().isEmpty()) {
            sb.append("Files: ").append(String.join(", ", analysis.filesToModify())).append('\n');
        }
        if (feedback != null && !feedback.isBlank()) {
            sb.append("\nThe previous attempt failed verification:\n").append(feedback).append('\n');
        }
        sb.append("\nWhen done, respond with a single JSON object with the fields ")
                .append("\"summary\" (string) and \"commitMessage\" (string).\n");
        return sb.toString();
    }

    private static void appendIssues(StringBuilder sb, IssueGroup group) {
        for (Issue issue : group.issues()) {
            sb.append("## #").append(issue.number()).append(' ').append(issue.title())
                    .append(" [").append(issue.type().name().toLowerCase()).append("]\n");
            if (!issue.body().isBlank()) {
                sb.append(issue.body().strip()).append('\n');
            }
            if (!issue.relatedFiles().isEmpty()) {
                sb.append("Related files: ").append(String.join(", ", issue.relatedFiles())).append('\n');
            }
            sb.append('\n');
        }
    }
}
