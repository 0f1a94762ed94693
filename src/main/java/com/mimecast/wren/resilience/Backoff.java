package com.mimecast.wren.resilience;

import io.github.resilience4j.core.IntervalFunction;

/**
 * Exponential backoff.
 *
 * <p>Stateless: the delay depends only on the retry number.
 * <pre>
 *     delay = min(initialDelay * multiplier ^ (retry - 1), maxDelay)
 * </pre>
 */
public class Backoff {

    private final IntervalFunction intervals;
    private final long initialDelayMillis;
    private final double multiplier;
    private final long maxDelayMillis;

    /**
     * Constructs a new Backoff instance.
     *
     * @param initialDelayMillis Delay before the first retry.
     * @param multiplier         Growth factor.
     * @param maxDelayMillis     Delay cap.
     */
    public Backoff(long initialDelayMillis, double multiplier, long maxDelayMillis) {
        this.initialDelayMillis = initialDelayMillis;
        this.multiplier = multiplier;
        this.maxDelayMillis = maxDelayMillis;
        this.intervals = IntervalFunction.ofExponentialBackoff(initialDelayMillis, multiplier, maxDelayMillis);
    }

    /**
     * Gets delay before a retry.
     *
     * @param retry One based retry number.
     * @return Delay in milliseconds.
     */
    public long delayMillis(int retry) {
        return intervals.apply(Math.max(1, retry));
    }

    public long getInitialDelayMillis() {
        return initialDelayMillis;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }
}
