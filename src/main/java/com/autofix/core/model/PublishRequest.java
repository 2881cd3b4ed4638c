package com.autofix.core.model;

/**
 * A pull/merge request opened for a fixed group.
 */
public record PublishRequest(int number, String url, String title, String branch, String baseBranch) {}
