package com.mimecast.wren.resilience;

import com.mimecast.wren.config.ResilienceConfig;

/**
 * Retry policy: retries allowed after the first attempt and the backoff between them.
 */
public class RetryPolicy {

    private final int maxRetries;
    private final Backoff backoff;

    /**
     * Constructs a new RetryPolicy instance.
     *
     * @param maxRetries Retries after the first attempt.
     * @param backoff    Backoff instance.
     */
    public RetryPolicy(int maxRetries, Backoff backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    /**
     * Builds policy from configuration.
     *
     * @param config ResilienceConfig instance.
     * @return RetryPolicy instance.
     */
    public static RetryPolicy fromConfig(ResilienceConfig config) {
        return new RetryPolicy(config.getMaxRetries(),
                new Backoff(config.getRetryDelayMillis(), config.getBackoffMultiplier(), config.getMaxDelayMillis()));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public Backoff getBackoff() {
        return backoff;
    }
}
