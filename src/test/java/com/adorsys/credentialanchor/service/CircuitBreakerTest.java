package com.adorsys.credentialanchor.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        circuitBreaker = new CircuitBreaker("horizon", 3, Duration.ofSeconds(30), clock);
    }

    @Test
    void opensAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertEquals(CircuitBreaker.State.CLOSED, circuitBreaker.getState());
        assertDoesNotThrow(() -> circuitBreaker.checkState());

        circuitBreaker.recordFailure();

        assertEquals(CircuitBreaker.State.OPEN, circuitBreaker.getState());
        assertThrows(CircuitBreaker.CircuitBreakerOpenException.class, () -> circuitBreaker.checkState());
    }

    @Test
    void successResetsFailureCount() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordSuccess();
        circuitBreaker.recordFailure();

        assertEquals(1, circuitBreaker.getFailureCount());
        assertEquals(CircuitBreaker.State.CLOSED, circuitBreaker.getState());
    }

    @Test
    void halfOpenTrialClosesOnSuccess() throws Exception {
        tripBreaker();

        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.checkState();
        assertEquals(CircuitBreaker.State.HALF_OPEN, circuitBreaker.getState());

        circuitBreaker.recordSuccess();
        assertEquals(CircuitBreaker.State.CLOSED, circuitBreaker.getState());
    }

    @Test
    void halfOpenTrialReopensOnFailure() throws Exception {
        tripBreaker();
        clock.advance(Duration.ofSeconds(31));
        circuitBreaker.checkState();

        circuitBreaker.recordFailure();

        assertEquals(CircuitBreaker.State.OPEN, circuitBreaker.getState());
        clock.advance(Duration.ofSeconds(29));
        assertThrows(CircuitBreaker.CircuitBreakerOpenException.class, () -> circuitBreaker.checkState());
    }

    @Test
    void halfOpenAdmitsSingleTrial() throws Exception {
        tripBreaker();
        clock.advance(Duration.ofSeconds(30));

        circuitBreaker.checkState();
        for (int i = 0; i < 4; i++) {
            assertThrows(CircuitBreaker.CircuitBreakerOpenException.class, () -> circuitBreaker.checkState());
        }
        assertEquals(CircuitBreaker.State.HALF_OPEN, circuitBreaker.getState());

        circuitBreaker.recordSuccess();
        assertDoesNotThrow(() -> circuitBreaker.checkState());
        assertDoesNotThrow(() -> circuitBreaker.checkState());
    }

    @Test
    void failedTrialAllowsNextTrialAfterCooldown() throws Exception {
        tripBreaker();
        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.checkState();
        circuitBreaker.recordFailure();

        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.checkState();

        assertEquals(CircuitBreaker.State.HALF_OPEN, circuitBreaker.getState());
        assertThrows(CircuitBreaker.CircuitBreakerOpenException.class, () -> circuitBreaker.checkState());
    }

    @Test
    void staleTrialIsReplacedAfterCooldown() throws Exception {
        tripBreaker();
        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.checkState();

        clock.advance(Duration.ofSeconds(10));
        assertThrows(CircuitBreaker.CircuitBreakerOpenException.class, () -> circuitBreaker.checkState());
        clock.advance(Duration.ofSeconds(20));
        assertDoesNotThrow(() -> circuitBreaker.checkState());
    }

    @Test
    void rejectsInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("x", 0, Duration.ofSeconds(1)));
    }

    private void tripBreaker() {
        for (int i = 0; i < 3; i++) {
            circuitBreaker.recordFailure();
        }
        assertEquals(CircuitBreaker.State.OPEN, circuitBreaker.getState());
    }
}
