package com.mimecast.mailroom.runner;

import com.mimecast.mailroom.config.RetryConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy using capped exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * multiplier^(attempt-1)}, capped at {@code maxDelay},
 * then scaled by a random factor in {@code [1-jitter, 1+jitter)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final int maxRetries;
    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitter;
    private final DoubleSupplier random;

    /**
     * Constructs a new policy from configuration.
     *
     * @param config Retry configuration.
     */
    public ExponentialBackoffRetryPolicy(RetryConfig config) {
        this(config.getMaxRetries(), config.getBaseDelaySeconds() * 1000L, config.getMultiplier(),
                config.getMaxDelaySeconds() * 1000L, config.getJitter(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Constructs a new policy.
     *
     * @param maxRetries  Failed attempts before shunting, at least 1.
     * @param baseDelayMs Delay before the first retry.
     * @param multiplier  Growth factor, at least 1.
     * @param maxDelayMs  Delay cap.
     * @param jitter      Jitter factor in [0, 1).
     * @param random      Source of uniform values in [0, 1).
     */
    public ExponentialBackoffRetryPolicy(int maxRetries, long baseDelayMs, double multiplier, long maxDelayMs,
                                         double jitter, DoubleSupplier random) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (multiplier < 1.0D) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        if (maxDelayMs < 0) {
            throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
        }
        if (jitter < 0.0D || jitter >= 1.0D) {
            throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
        }
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        // Doubles saturate to infinity rather than overflow.
        double exponential = baseDelayMs * Math.pow(multiplier, attempts - 1);
        double capped = Math.min((double) maxDelayMs, exponential);
        double factor = 1.0D - jitter + 2.0D * jitter * random.getAsDouble();
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
    }
}
