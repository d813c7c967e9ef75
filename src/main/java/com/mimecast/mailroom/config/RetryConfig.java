package com.mimecast.mailroom.config;

import java.util.Map;

/**
 * Configuration class for transient failure retry settings.
 * <p>Backoff: {@code baseDelaySeconds * multiplier^(retry-1)}, capped at {@code maxDelaySeconds}
 * and spread by {@code jitter} (0.25 means +/-25%).
 */
public class RetryConfig extends BasicConfig {

    /**
     * Constructs a new RetryConfig instance.
     *
     * @param map Configuration map.
     */
    public RetryConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum number of retries before an entry is shunted.
     *
     * @return Integer.
     */
    public int getMaxRetries() {
        return Math.toIntExact(getLongProperty("maxRetries", 5L));
    }

    /**
     * Gets delay before the first retry.
     *
     * @return Seconds.
     */
    public long getBaseDelaySeconds() {
        return getLongProperty("baseDelaySeconds", 60L);
    }

    /**
     * Gets the geometric growth factor.
     *
     * @return Double.
     */
    public double getMultiplier() {
        return getDoubleProperty("multiplier", 2.0D);
    }

    /**
     * Gets the delay cap.
     *
     * @return Seconds.
     */
    public long getMaxDelaySeconds() {
        return getLongProperty("maxDelaySeconds", 3600L);
    }

    /**
     * Gets the jitter ratio.
     *
     * @return Ratio between 0 and 1.
     */
    public double getJitter() {
        return getDoubleProperty("jitter", 0.25D);
    }
}
