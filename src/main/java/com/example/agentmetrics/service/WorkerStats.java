package com.example.agentmetrics.service;

import java.time.Instant;

/**
 * Liveness snapshot of one category loop.
 */
public record WorkerStats(boolean running, Instant lastIterationAt, long processed, long failedIterations) {
}
