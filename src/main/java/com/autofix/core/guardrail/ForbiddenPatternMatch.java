package com.autofix.core.guardrail;

/**
 * A line of a proposed change that matched a forbidden pattern.
 *
 * @param filePath   repository-relative path
 * @param lineNumber 1-based line number
 * @param pattern    the regular expression that matched
 * @param content    the matched line, trimmed
 */
public record ForbiddenPatternMatch(String filePath, int lineNumber, String pattern, String content) {}
