package com.mimecast.wren.resilience;

import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.exception.ExternalServiceException;
import com.mimecast.wren.exception.ServiceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilientExecutorTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    private CircuitBreaker breaker;
    private ResilientExecutor executor;

    @BeforeEach
    void setUp() {
        breaker = new CircuitBreaker("ocr", 5, Duration.ofSeconds(60), new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        executor = new ResilientExecutor(breaker, new RetryPolicy(3, new Backoff(100, 2.0, 250)), sleeps::add);
    }

    @Test
    void testRecoversAfterTransientFailures() throws ExternalServiceException {
        ResilientResult<String> result = executor.execute("ocr", () -> {
            if (calls.incrementAndGet() <= 2) {
                throw ServiceCallException.timeout("Read timed out", null);
            }
            return "text";
        });

        assertEquals("text", result.getValue());
        assertEquals(3, result.getAttempts());
        assertEquals(2, result.getRetries());
        assertEquals(List.of(100L, 200L), sleeps);
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
    }

    @Test
    void testBackoffCapped() {
        Backoff backoff = new Backoff(100, 2.0, 250);

        assertEquals(100, backoff.delayMillis(1));
        assertEquals(200, backoff.delayMillis(2));
        assertEquals(250, backoff.delayMillis(3));
        assertEquals(250, backoff.delayMillis(10));
    }

    @Test
    void testPermanentFailureNotRetried() {
        ExternalServiceException e = assertThrows(ExternalServiceException.class, () -> executor.execute("ocr", () -> {
            calls.incrementAndGet();
            throw ServiceCallException.forStatus(400, "Bad request");
        }));

        assertEquals(1, calls.get());
        assertEquals(1, e.getAttempts());
        assertEquals(ErrorKind.EXTERNAL_SERVICE, e.getKind());
        assertTrue(sleeps.isEmpty());
        assertEquals(0, breaker.getFailureCount(), "Client errors do not count against the endpoint");
    }

    @Test
    void testRetriesExhausted() {
        ExternalServiceException e = assertThrows(ExternalServiceException.class, () -> executor.execute("ocr", () -> {
            calls.incrementAndGet();
            throw new IOException("Connection reset");
        }));

        assertEquals(4, calls.get());
        assertEquals(4, e.getAttempts());
        assertTrue(e.getMessage().contains("Connection reset"));
        assertEquals(3, sleeps.size());
        assertEquals(4, breaker.getFailureCount());
    }

    @Test
    void testServerErrorsAreTransient() throws ExternalServiceException {
        ResilientResult<Integer> result = executor.execute("ocr", () -> {
            if (calls.incrementAndGet() == 1) {
                throw ServiceCallException.forStatus(503, "Service Unavailable");
            }
            return 42;
        });

        assertEquals(42, result.getValue());
        assertEquals(2, result.getAttempts());
        assertTrue(ServiceCallException.isTransientStatus(429));
        assertFalse(ServiceCallException.isTransientStatus(404));
    }

    @Test
    void testOpenCircuitFailsFast() {
        breaker = new CircuitBreaker("ocr", 2, Duration.ofSeconds(60), new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        executor = new ResilientExecutor(breaker, new RetryPolicy(3, new Backoff(1, 1.0, 1)), sleeps::add);

        ServiceUnavailableException e = assertThrows(ServiceUnavailableException.class, () -> executor.execute("ocr", () -> {
            calls.incrementAndGet();
            throw ServiceCallException.forStatus(500, "Internal Server Error");
        }));

        assertEquals(2, calls.get(), "No calls after the circuit opened");
        assertEquals(2, e.getAttempts());
        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, e.getKind());
        assertEquals(CircuitState.OPEN, breaker.getState());

        assertThrows(ServiceUnavailableException.class, () -> executor.execute("ocr", () -> {
            calls.incrementAndGet();
            return "never";
        }));
        assertEquals(2, calls.get());
    }

    @Test
    void testZeroRetries() {
        executor = new ResilientExecutor(breaker, new RetryPolicy(0, new Backoff(1, 1.0, 1)), sleeps::add);

        assertThrows(ExternalServiceException.class, () -> executor.execute("ocr", () -> {
            calls.incrementAndGet();
            throw ServiceCallException.timeout("timeout", null);
        }));
        assertEquals(1, calls.get());
    }
}
