package com.mimecast.wren.resilience;

import com.mimecast.wren.config.ResilienceConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breakers keyed by endpoint.
 *
 * <p>Created explicitly and injected; breaker state persists for the lifetime of the registry.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    /**
     * Constructs a new CircuitBreakerRegistry instance.
     *
     * @param failureThreshold Consecutive failures that open a circuit.
     * @param recoveryTimeout  Time spent open before a trial call.
     * @param clock            Time source.
     */
    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    /**
     * Builds registry from configuration using the system clock.
     *
     * @param config ResilienceConfig instance.
     * @return CircuitBreakerRegistry instance.
     */
    public static CircuitBreakerRegistry fromConfig(ResilienceConfig config) {
        return new CircuitBreakerRegistry(config.getFailureThreshold(),
                Duration.ofSeconds(config.getRecoveryTimeoutSeconds()), Clock.systemUTC());
    }

    /**
     * Gets or creates breaker for endpoint.
     *
     * @param endpoint Endpoint name.
     * @return CircuitBreaker instance.
     */
    public CircuitBreaker get(String endpoint) {
        return breakers.computeIfAbsent(endpoint, k -> new CircuitBreaker(k, failureThreshold, recoveryTimeout, clock));
    }

    /**
     * Resets every breaker to CLOSED.
     */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    public Map<String, CircuitBreaker> getBreakers() {
        return Map.copyOf(breakers);
    }
}
