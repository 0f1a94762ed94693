package com.mimecast.wren.exception;

/**
 * Thrown without any network attempt while an endpoint circuit is open.
 */
public class ServiceUnavailableException extends ExternalServiceException {

    /**
     * Endpoint name.
     */
    private final String endpoint;

    /**
     * Constructs a new ServiceUnavailableException instance.
     *
     * @param endpoint Endpoint name.
     * @param attempts Attempts made before the circuit refused.
     */
    public ServiceUnavailableException(String endpoint, int attempts) {
        super(ErrorKind.SERVICE_UNAVAILABLE, "Circuit open for endpoint: " + endpoint, attempts, null);
        this.endpoint = endpoint;
    }

    /**
     * Gets endpoint name.
     *
     * @return Endpoint name.
     */
    public String getEndpoint() {
        return endpoint;
    }
}
