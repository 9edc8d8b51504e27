package io.brokerguard.infrastructure.common;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff.
 *
 * Immutable: one policy is shared by every refresh attempt, each attempt loop counts its own failures.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(8))
 *     .multiplier(2.0)
 *     .maxAttempts(4)
 *     .build();
 *
 * for (int attempt = 1; ; attempt++) {
 *     try {
 *         return exchange();
 *     } catch (TransientException e) {
 *         if (!policy.shouldRetry(attempt)) throw e;
 *         Thread.sleep(policy.delayAfter(attempt).toMillis());
 *     }
 * }
 * </pre>
 */
public final class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param failedAttempts number of attempts made so far (1-based), all of which failed
     * @return true if another attempt is allowed
     */
    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt: initialDelay * multiplier^(n-1), capped at maxDelay.
     */
    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts <= 0) {
            throw new IllegalArgumentException("failedAttempts must be positive");
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, failedAttempts - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for OAuth refresh-token exchanges: 4 attempts, 500ms doubling up to 8s.
     */
    public static RetryPolicy forOAuthRefresh() {
        return builder()
            .initialDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(8))
            .multiplier(2.0)
            .maxAttempts(4)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(8);
        private double multiplier = 2.0;
        private int maxAttempts = 4;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
