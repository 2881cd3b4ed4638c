package com.autofix.core.model;

import java.util.List;

/**
 * Assessment of an issue group produced by the AI integration.
 *
 * @param issueNumbers  issues analysed
 * @param filesToModify files the fix is expected to touch
 * @param rootCause     diagnosed root cause
 * @param suggestedFix  proposed fix strategy
 * @param confidence    0..1
 * @param complexity    estimated complexity
 */
public record AnalysisResult(
    List<Integer> issueNumbers,
    List<String> filesToModify,
    String rootCause,
    String suggestedFix,
    double confidence,
    Complexity complexity
) {

    public AnalysisResult {
        issueNumbers = issueNumbers == null ? List.of() : List.copyOf(issueNumbers);
        filesToModify = filesToModify == null ? List.of() : List.copyOf(filesToModify);
    }
}
