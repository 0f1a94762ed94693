package com.mimecast.wren.resilience;

/**
 * Failure of a single external call.
 *
 * <p>Transient failures (timeouts, 5xx, 429) are retried and count against the circuit breaker.
 * <br>Anything else surfaces immediately.
 */
public class ServiceCallException extends Exception {

    private final boolean transientFailure;
    private final int statusCode;

    /**
     * Constructs a new ServiceCallException instance.
     *
     * @param message          Error message.
     * @param statusCode       HTTP status or -1.
     * @param transientFailure Is transient.
     * @param cause            Underlying cause.
     */
    public ServiceCallException(String message, int statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    /**
     * Builds exception for HTTP status.
     *
     * @param statusCode HTTP status.
     * @param message    Error message.
     * @return ServiceCallException instance.
     */
    public static ServiceCallException forStatus(int statusCode, String message) {
        return new ServiceCallException(message, statusCode, isTransientStatus(statusCode), null);
    }

    /**
     * Builds exception for timeout.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     * @return ServiceCallException instance.
     */
    public static ServiceCallException timeout(String message, Throwable cause) {
        return new ServiceCallException(message, -1, true, cause);
    }

    /**
     * Is status transient.
     *
     * @param statusCode HTTP status.
     * @return True for 429 and 5xx.
     */
    public static boolean isTransientStatus(int statusCode) {
        return statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
