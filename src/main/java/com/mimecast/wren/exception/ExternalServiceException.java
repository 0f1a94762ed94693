package com.mimecast.wren.exception;

/**
 * External service failure after retries are exhausted or on a non-retryable error.
 */
public class ExternalServiceException extends ConversionException {

    /**
     * Number of attempts made before giving up.
     */
    private final int attempts;

    /**
     * Constructs a new ExternalServiceException instance.
     *
     * @param message  Error message.
     * @param attempts Attempts made.
     * @param cause    Last failure.
     */
    public ExternalServiceException(String message, int attempts, Throwable cause) {
        this(ErrorKind.EXTERNAL_SERVICE, message, attempts, cause);
    }

    /**
     * Constructs a new ExternalServiceException instance with a given kind.
     *
     * @param kind     Error kind.
     * @param message  Error message.
     * @param attempts Attempts made.
     * @param cause    Last failure, may be null.
     */
    protected ExternalServiceException(ErrorKind kind, String message, int attempts, Throwable cause) {
        super(kind, message, cause);
        this.attempts = attempts;
    }

    /**
     * Gets attempts made.
     *
     * @return Attempt count.
     */
    public int getAttempts() {
        return attempts;
    }
}
