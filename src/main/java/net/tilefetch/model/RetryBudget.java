package net.tilefetch.model;

import java.time.Duration;

/**
 * Retry settings for a tile source: how many attempts each location gets and the
 * total wall-clock budget they share.
 *
 * @param retryCount number of attempts per location, at least one
 * @param totalTimeoutSeconds total budget per tile in seconds
 */
public record RetryBudget(int retryCount, double totalTimeoutSeconds) {

    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final double DEFAULT_TIMEOUT_SECONDS = 60.0;

    public RetryBudget {
        if (retryCount < 1) {
            throw new IllegalArgumentException("retryCount must be at least 1, got " + retryCount);
        }
        if (!(totalTimeoutSeconds > 0)) {
            throw new IllegalArgumentException("totalTimeoutSeconds must be positive, got " + totalTimeoutSeconds);
        }
    }

    public static RetryBudget defaults() {
        return new RetryBudget(DEFAULT_RETRY_COUNT, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Timeout applied to each individual attempt: the total budget split evenly
     * across the attempts.
     */
    public Duration perAttemptTimeout() {
        return toDuration(totalTimeoutSeconds / retryCount);
    }

    /**
     * Deadline for a whole tile, also used as the fan-out wait.
     */
    public Duration totalTimeout() {
        return toDuration(totalTimeoutSeconds);
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }
}
