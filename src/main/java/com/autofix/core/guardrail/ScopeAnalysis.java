package com.autofix.core.guardrail;

import java.util.List;

/**
 * Breadth of a proposed change set.
 *
 * @param totalFiles  number of changed files
 * @param directories distinct parent directories, sorted
 * @param components  component names found under components/modules/features/packages, sorted
 * @param tooBroad    true when either the file or directory limit is exceeded
 * @param warning     explanation when {@code tooBroad}, otherwise null
 */
public record ScopeAnalysis(
    int totalFiles,
    List<String> directories,
    List<String> components,
    boolean tooBroad,
    String warning
) {}
