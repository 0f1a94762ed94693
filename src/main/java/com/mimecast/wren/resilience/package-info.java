/**
 * Retry with backoff and circuit breaking for external calls.
 *
 * <p>The {@link com.mimecast.wren.resilience.ResilientExecutor} composes a stateless
 * {@link com.mimecast.wren.resilience.Backoff} with a stateful {@link com.mimecast.wren.resilience.CircuitBreaker}
 * taken from an injected {@link com.mimecast.wren.resilience.CircuitBreakerRegistry}.
 *
 * <p>Total attempts are {@code maxRetries + 1}.
 */
package com.mimecast.wren.resilience;
