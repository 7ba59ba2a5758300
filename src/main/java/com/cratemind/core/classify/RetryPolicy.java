package com.cratemind.core.classify;

import com.cratemind.core.llm.ClassifierConfigurationException;

import java.time.Duration;

/**
 * Attempt budget, acceptance threshold and exponential backoff for one batch.
 *
 * @param maxAttempts         total attempts per batch, at least 1
 * @param acceptanceThreshold minimum fraction of a batch that must resolve for an attempt to be accepted
 * @param timeUnit            one backoff unit; the wait after attempt {@code a} is {@code 2^a} units
 */
public record RetryPolicy(int maxAttempts, double acceptanceThreshold, Duration timeUnit) {

    public static final double ACCEPTANCE_THRESHOLD = 0.7;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new ClassifierConfigurationException("max retries must be a positive integer, got " + maxAttempts);
        }
        if (timeUnit == null || timeUnit.isNegative()) {
            throw new ClassifierConfigurationException("time unit must be a non-negative duration, got " + timeUnit);
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration timeUnit) {
        return new RetryPolicy(maxAttempts, ACCEPTANCE_THRESHOLD, timeUnit);
    }

    public static double successRate(int resolved, int batchSize) {
        return batchSize == 0 ? 0.0 : (double) resolved / batchSize;
    }

    public boolean accepts(int resolved, int batchSize) {
        return successRate(resolved, batchSize) >= acceptanceThreshold;
    }

    /**
     * Whether another attempt follows the 0-based attempt {@code attempt}.
     */
    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts - 1;
    }

    /**
     * Wait inserted after the failed 0-based attempt {@code attempt}.
     */
    public Duration backoffAfter(int attempt) {
        return timeUnit.multipliedBy(1L << Math.min(attempt, 30));
    }
}
