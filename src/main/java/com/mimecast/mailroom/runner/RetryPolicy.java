package com.mimecast.mailroom.runner;

/**
 * Strategy for spacing out retries of transiently failing entries.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Gets the number of failed attempts after which an entry is shunted.
     *
     * @return Max retries.
     */
    int getMaxRetries();

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempts Failed attempts so far, 1 based.
     * @return Delay in milliseconds, non negative.
     */
    long computeDelayMs(int attempts);
}
