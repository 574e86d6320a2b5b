package com.alertwarden.core.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for notification attempts.
 *
 * <p>
 * {@code maxAttempts} counts every delivery call, the first one included.
 * After failed attempt {@code n} the next one is delayed by
 * {@code base * 2^(n-1)}, capped at {@code maxBackoff}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final Duration base;
    private final Duration maxBackoff;
    private final int maxAttempts;

    public RetryPolicy(Duration base, Duration maxBackoff, int maxAttempts) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (base.isZero() || base.isNegative()) {
            throw new IllegalArgumentException("base must be positive, got: " + base);
        }
        if (maxBackoff.compareTo(base) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= base, got: " + maxBackoff);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return {@code true} if another attempt is allowed
     */
    public boolean canRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1, got: " + failedAttempt);
        }
        int shift = Math.min(failedAttempt - 1, 30);
        long millis = base.toMillis();
        if (millis > maxBackoff.toMillis() >> shift) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis << shift);
    }

    public Duration getBase() {
        return base;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return "RetryPolicy{base=" + base + ", maxBackoff=" + maxBackoff + ", maxAttempts=" + maxAttempts + '}';
    }
}
