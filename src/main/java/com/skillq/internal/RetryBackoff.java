package com.skillq.internal;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Capped exponential backoff: the n-th retry (0-based) waits {@code min(base * 2^n, cap)}.
 */
public final class RetryBackoff {

    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryBackoff(Duration baseDelay, Duration maxDelay) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * @param retryCount retries already performed, before this failure is counted
     */
    public Duration delayFor(int retryCount) {
        int shift = Math.min(Math.max(0, retryCount), MAX_SHIFT);
        long maxMillis = maxDelay.toMillis();
        long baseMillis = baseDelay.toMillis();
        if (baseMillis > (maxMillis >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMillis << shift, maxMillis));
    }

    public RetryDecision decide(int retryCount, int maxRetries, boolean retryable, OffsetDateTime now) {
        if (!retryable || retryCount >= maxRetries) {
            return new RetryDecision(false, retryCount, null);
        }
        return new RetryDecision(true, retryCount + 1, now.plus(delayFor(retryCount)));
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public record RetryDecision(boolean retry, int nextRetryCount, OffsetDateTime retryAfter) {
    }
}
