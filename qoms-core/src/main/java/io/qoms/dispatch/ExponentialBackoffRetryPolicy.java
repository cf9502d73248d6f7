package io.qoms.dispatch;

/**
 * Retry policy using capped exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(retryCount-1)}, capped at {@code maxDelay}. With a
 * base of 100 ms the delays are 100, 200, 400 ms and so on; they never decrease.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelayMs delay before the first retry (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int retryCount) {
        if (retryCount <= 0) {
            return 0L;
        }
        if (retryCount >= 63) {
            return maxDelayMs;
        }
        long shift = 1L << (retryCount - 1);
        // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
        if (shift > maxDelayMs / baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, baseDelayMs * shift);
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }
}
