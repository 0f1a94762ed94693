package com.mimecast.wren.resilience;

/**
 * Value of a resilient call and the attempts it took.
 *
 * @param <T> Value type.
 */
public class ResilientResult<T> {

    private final T value;
    private final int attempts;

    public ResilientResult(T value, int attempts) {
        this.value = value;
        this.attempts = attempts;
    }

    public T getValue() {
        return value;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getRetries() {
        return attempts - 1;
    }
}
