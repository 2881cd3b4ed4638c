package com.autofix.core.queue;

/**
 * Point-in-time counters of a {@link ProcessingQueue}.
 */
public record QueueStats(int total, int pending, int inFlight, int completed, int failed) {}
