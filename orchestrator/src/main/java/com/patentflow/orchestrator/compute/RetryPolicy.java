package com.patentflow.orchestrator.compute;

import java.time.Duration;

/**
 * Bounded exponential backoff: after failed attempt n (counted from 0) wait
 * baseDelay * 2^n before the next one, for at most maxAttempts attempts.
 *
 * With the defaults (5 attempts, 1 s) the waits are 1, 2, 4 and 8 seconds.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative (current: " + baseDelay + ")");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(1));
    }

    /** Wait after the failed attempt with the given 0-based index. */
    public Duration backoff(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative (current: " + attempt + ")");
        }
        // cap the shift so a misconfigured maxAttempts cannot overflow
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }
}
