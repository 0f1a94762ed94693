package com.mimecast.wren.resilience;

import java.io.IOException;

/**
 * One attempt at an external call.
 *
 * @param <T> Result type.
 */
@FunctionalInterface
public interface ServiceCall<T> {

    /**
     * Performs the call.
     *
     * @return Result.
     * @throws ServiceCallException Classified failure.
     * @throws IOException          Network failure, treated as transient.
     */
    T call() throws ServiceCallException, IOException;
}
