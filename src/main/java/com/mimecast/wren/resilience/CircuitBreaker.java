package com.mimecast.wren.resilience;

import com.mimecast.wren.exception.ServiceUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker for one external endpoint.
 *
 * <p>Transitions:
 * <ul>
 *     <li>CLOSED to OPEN when consecutive failures reach the threshold</li>
 *     <li>OPEN to HALF_OPEN on the first call after the recovery timeout</li>
 *     <li>HALF_OPEN to CLOSED when the single trial call succeeds</li>
 *     <li>HALF_OPEN to OPEN when the trial call fails</li>
 * </ul>
 * <p>{@link #reset()} returns to CLOSED from any state.
 * <p>Each transition starts a new generation. {@link #acquire()} returns the generation the call was admitted
 * under and outcomes reported for an older generation are ignored, so a slow call admitted while CLOSED cannot
 * close an OPEN circuit or end another caller's trial.
 * <p>State is guarded by the breaker monitor.
 */
public class CircuitBreaker {
    private static final Logger log = LogManager.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount = 0;
    private Instant openedAt;
    private boolean trialInFlight = false;
    private long generation = 0;

    /**
     * Constructs a new CircuitBreaker instance.
     *
     * @param name             Endpoint name.
     * @param failureThreshold Consecutive failures that open the circuit.
     * @param recoveryTimeout  Time spent open before a trial call.
     * @param clock            Time source.
     */
    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    /**
     * Acquires permission for one call.
     *
     * @return Permit to hand back with the outcome.
     * @throws ServiceUnavailableException Circuit open or trial already in flight.
     */
    public synchronized long acquire() throws ServiceUnavailableException {
        switch (state) {
            case CLOSED:
                return generation;

            case OPEN:
                if (!clock.instant().isBefore(openedAt.plus(recoveryTimeout))) {
                    log.info("Circuit {} half open, admitting trial call", name);
                    transition(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    return generation;
                }
                throw new ServiceUnavailableException(name, 0);

            case HALF_OPEN:
            default:
                if (!trialInFlight) {
                    trialInFlight = true;
                    return generation;
                }
                throw new ServiceUnavailableException(name, 0);
        }
    }

    /**
     * Records successful call.
     *
     * @param permit Value returned by {@link #acquire()}.
     */
    public synchronized void onSuccess(long permit) {
        if (isStale(permit, "success")) {
            return;
        }
        if (state == CircuitState.HALF_OPEN) {
            log.info("Circuit {} closed after successful trial", name);
            transition(CircuitState.CLOSED);
            openedAt = null;
        }
        failureCount = 0;
        trialInFlight = false;
    }

    /**
     * Records failed call.
     *
     * @param permit Value returned by {@link #acquire()}.
     */
    public synchronized void onFailure(long permit) {
        if (isStale(permit, "failure")) {
            return;
        }
        if (state == CircuitState.HALF_OPEN) {
            open();
            return;
        }
        failureCount++;
        if (failureCount >= failureThreshold) {
            open();
        }
    }

    /**
     * Releases a permit without recording an outcome.
     * <p>Used for failures that say nothing about endpoint health.
     *
     * @param permit Value returned by {@link #acquire()}.
     */
    public synchronized void release(long permit) {
        if (permit == generation && state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    /**
     * Resets to CLOSED.
     */
    public synchronized void reset() {
        transition(CircuitState.CLOSED);
        failureCount = 0;
        trialInFlight = false;
        openedAt = null;
    }

    private boolean isStale(long permit, String outcome) {
        if (permit != generation) {
            log.debug("Circuit {} ignoring late {} from generation {}, now {} in generation {}",
                    name, outcome, permit, state, generation);
            return true;
        }
        return false;
    }

    private void transition(CircuitState next) {
        state = next;
        generation++;
    }

    private void open() {
        transition(CircuitState.OPEN);
        openedAt = clock.instant();
        trialInFlight = false;
        log.warn("Circuit {} opened after {} consecutive failures", name, failureCount);
    }

    public String getName() {
        return name;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getOpenedAt() {
        return openedAt;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }
}
