package com.mimecast.wren.config;

import java.util.Map;

/**
 * Retry and circuit breaker configuration for an external endpoint.
 */
public class ResilienceConfig extends ConfigFoundation {

    /**
     * Constructs a new ResilienceConfig instance.
     *
     * @param map Configuration map.
     */
    public ResilienceConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets retries allowed after the first attempt.
     *
     * @return Retry count.
     */
    public int getMaxRetries() {
        return Math.toIntExact(getLongProperty("maxRetries", 3L));
    }

    /**
     * Gets initial retry delay in milliseconds.
     *
     * @return Milliseconds.
     */
    public long getRetryDelayMillis() {
        return getLongProperty("retryDelayMillis", 1000L);
    }

    /**
     * Gets backoff multiplier.
     *
     * @return Multiplier.
     */
    public double getBackoffMultiplier() {
        return getDoubleProperty("backoffMultiplier", 2.0);
    }

    /**
     * Gets maximum single retry delay in milliseconds.
     *
     * @return Milliseconds.
     */
    public long getMaxDelayMillis() {
        return getLongProperty("maxDelayMillis", 30_000L);
    }

    /**
     * Gets consecutive failures that open the circuit.
     *
     * @return Threshold.
     */
    public int getFailureThreshold() {
        return Math.toIntExact(getLongProperty("failureThreshold", 5L));
    }

    /**
     * Gets seconds an open circuit waits before allowing a trial call.
     *
     * @return Seconds.
     */
    public long getRecoveryTimeoutSeconds() {
        return getLongProperty("recoveryTimeoutSeconds", 300L);
    }
}
