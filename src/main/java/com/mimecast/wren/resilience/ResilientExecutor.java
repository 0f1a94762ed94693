package com.mimecast.wren.resilience;

import com.mimecast.wren.exception.ExternalServiceException;
import com.mimecast.wren.exception.ServiceUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Runs external calls through a circuit breaker with bounded retries.
 *
 * <p>Every attempt first acquires the breaker, an open circuit fails fast without calling out.
 * <br>Transient failures are recorded against the breaker and retried after the backoff delay.
 * <br>Other failures release the breaker untouched and surface immediately.
 */
public class ResilientExecutor {
    private static final Logger log = LogManager.getLogger(ResilientExecutor.class);

    private final CircuitBreaker breaker;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    /**
     * Constructs a new ResilientExecutor instance.
     *
     * @param breaker CircuitBreaker instance.
     * @param policy  RetryPolicy instance.
     */
    public ResilientExecutor(CircuitBreaker breaker, RetryPolicy policy) {
        this(breaker, policy, Sleeper.SYSTEM);
    }

    /**
     * Constructs a new ResilientExecutor instance.
     *
     * @param breaker CircuitBreaker instance.
     * @param policy  RetryPolicy instance.
     * @param sleeper Sleeper instance.
     */
    public ResilientExecutor(CircuitBreaker breaker, RetryPolicy policy, Sleeper sleeper) {
        this.breaker = breaker;
        this.policy = policy;
        this.sleeper = sleeper;
    }

    /**
     * Executes call.
     *
     * @param operation Operation name for logging.
     * @param call      ServiceCall instance.
     * @param <T>       Result type.
     * @return ResilientResult instance.
     * @throws ServiceUnavailableException Circuit open.
     * @throws ExternalServiceException    Non transient failure or retries exhausted.
     */
    public <T> ResilientResult<T> execute(String operation, ServiceCall<T> call) throws ExternalServiceException {
        Exception last = null;
        int attempt = 0;
        while (attempt < policy.getMaxAttempts()) {
            if (attempt > 0) {
                long delay = policy.getBackoff().delayMillis(attempt);
                log.info("Retrying {} on {} in {}ms (retry {}/{})", operation, breaker.getName(), delay, attempt, policy.getMaxRetries());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ExternalServiceException(operation + " interrupted during backoff", attempt, e);
                }
            }

            long permit;
            try {
                permit = breaker.acquire();
            } catch (ServiceUnavailableException e) {
                log.warn("{} on {} rejected, circuit {}", operation, breaker.getName(), breaker.getState());
                throw new ServiceUnavailableException(breaker.getName(), attempt);
            }
            attempt++;
            try {
                T value = call.call();
                breaker.onSuccess(permit);
                if (attempt > 1) {
                    log.info("{} on {} succeeded after {} attempts", operation, breaker.getName(), attempt);
                }
                return new ResilientResult<>(value, attempt);

            } catch (ServiceCallException e) {
                if (!e.isTransient()) {
                    breaker.release(permit);
                    log.warn("{} on {} failed permanently: {}", operation, breaker.getName(), e.getMessage());
                    throw new ExternalServiceException(operation + " failed: " + e.getMessage(), attempt, e);
                }
                breaker.onFailure(permit);
                last = e;
                log.warn("{} on {} attempt {} failed: {}", operation, breaker.getName(), attempt, e.getMessage());

            } catch (IOException e) {
                breaker.onFailure(permit);
                last = e;
                log.warn("{} on {} attempt {} failed: {}", operation, breaker.getName(), attempt, e.getMessage());

            } catch (RuntimeException e) {
                breaker.release(permit);
                throw e;
            }
        }

        throw new ExternalServiceException(operation + " failed after " + attempt + " attempts"
                + (last != null ? ": " + last.getMessage() : ""), attempt, last);
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
