package com.mimecast.wren.resilience;

/**
 * Sleep abstraction so retry delays can be skipped in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Thread sleeper.
     */
    Sleeper SYSTEM = Thread::sleep;

    /**
     * Sleeps.
     *
     * @param millis Milliseconds.
     * @throws InterruptedException Interrupted while sleeping.
     */
    void sleep(long millis) throws InterruptedException;
}
