package com.mimecast.wren.resilience;

/**
 * Circuit breaker state.
 */
public enum CircuitState {
    /**
     * Calls pass through.
     */
    CLOSED,

    /**
     * Calls fail fast until the recovery timeout elapses.
     */
    OPEN,

    /**
     * A single trial call is admitted.
     */
    HALF_OPEN
}
