package com.entity.reconciliation.lock;

/**
 * Wait policy of {@link LocalKeyLock}.
 *
 * @param timeoutMs    wait per attempt
 * @param maxRetries   attempts after the first
 * @param retryDelayMs pause between attempts
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs) {

    public LockConfig {
        if (timeoutMs <= 0 || retryDelayMs <= 0) {
            throw new IllegalArgumentException(String.format(
                    "lock timeout and retry delay must be positive, got %dms and %dms", timeoutMs, retryDelayMs));
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("lock retries must not be negative, got " + maxRetries);
        }
    }

    /**
     * One attempt of 5 seconds.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 0, 100);
    }

    /**
     * Total number of attempts.
     */
    public int attempts() {
        return maxRetries + 1;
    }
}
