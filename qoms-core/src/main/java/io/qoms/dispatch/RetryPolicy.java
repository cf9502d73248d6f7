package io.qoms.dispatch;

/**
 * Strategy for computing the delay before a failed item becomes eligible again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param retryCount failed attempts so far, including the one just recorded (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retryCount);
}
