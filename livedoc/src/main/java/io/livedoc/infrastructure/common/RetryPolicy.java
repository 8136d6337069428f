package io.livedoc.infrastructure.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Retry policy with bounded exponential backoff.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum attempt limit (exhausted after maxAttempts failures)
 * - Maximum backoff duration (cap)
 * - Reset after success
 *
 * Instances are stateful. Use {@link #fresh()} to get an independent policy per operation.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = template.fresh();
 * while (true) {
 *     try {
 *         return store.write(...);
 *     } catch (StoreUnavailableException e) {
 *         policy.recordFailure();
 *         if (!policy.shouldRetry()) throw e;
 *         sleeper.sleep(policy.getNextDelay());
 *     }
 * }
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * Whether another attempt is allowed.
     *
     * @return false once maxAttempts failures have been recorded
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt: initialDelay * multiplier^(failures-1), capped at maxDelay.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and grow the delay for the attempt after the next one.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();
        if (attemptCount > 1) {
            long next = (long) (currentDelay.toMillis() * multiplier);
            currentDelay = Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
        }
    }

    /**
     * Record a successful attempt. Resets all counters.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
    }

    public synchronized boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * New policy with the same settings and no recorded failures.
     */
    public RetryPolicy fresh() {
        return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for store operations: 3 attempts, 50ms, 100ms between them.
     */
    public static RetryPolicy forStore() {
        return builder()
            .initialDelay(Duration.ofMillis(50))
            .maxDelay(Duration.ofSeconds(1))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Pause between attempts. Tests substitute a recording no-op.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;

        Sleeper THREAD = d -> Thread.sleep(d.toMillis());
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(50);
        private Duration maxDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

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
