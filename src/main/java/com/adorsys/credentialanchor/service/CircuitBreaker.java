package com.adorsys.credentialanchor.service;

import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker in front of the ledger endpoint.
 *
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Too many consecutive failures, requests fail fast until the cooldown has passed
 * - HALF_OPEN: One trial request decides between CLOSED and OPEN, other requests fail fast meanwhile.
 *   A trial that never reports back is replaced after another cooldown.
 */
public class CircuitBreaker {

    private static final Logger logger = Logger.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final long cooldownMillis;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong openedAt = new AtomicLong(0);
    private final AtomicBoolean trialInFlight = new AtomicBoolean(false);
    private final AtomicLong trialStartedAt = new AtomicLong(0);

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown) {
        this(name, failureThreshold, cooldown, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldownMillis = cooldown.toMillis();
        this.clock = clock;

        logger.infof("Circuit breaker '%s' initialized: failureThreshold=%d, cooldown=%dms",
                name, failureThreshold, cooldownMillis);
    }

    /**
     * Checks if a request should be allowed through the circuit breaker.
     *
     * @throws CircuitBreakerOpenException if the circuit is open
     */
    public void checkState() throws CircuitBreakerOpenException {
        State current = state.get();
        if (current == State.CLOSED) {
            return;
        }
        long now = clock.millis();
        if (current == State.OPEN) {
            if (now - openedAt.get() < cooldownMillis) {
                throw new CircuitBreakerOpenException(
                        String.format("Circuit breaker '%s' is OPEN. Failing fast.", name));
            }
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                logger.infof("Circuit breaker '%s' transitioning to HALF_OPEN", name);
            }
        }

        // HALF_OPEN: only the caller that claims the trial slot goes through
        if (trialInFlight.compareAndSet(false, true)) {
            trialStartedAt.set(now);
            return;
        }
        long started = trialStartedAt.get();
        if (now - started >= cooldownMillis && trialStartedAt.compareAndSet(started, now)) {
            logger.warnf("Circuit breaker '%s' trial request did not report back, admitting a new one", name);
            return;
        }
        throw new CircuitBreakerOpenException(
                String.format("Circuit breaker '%s' is HALF_OPEN with a trial request in flight. Failing fast.", name));
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
        if (state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            trialInFlight.set(false);
            logger.infof("Circuit breaker '%s' transitioning to CLOSED after successful test", name);
        }
    }

    public void recordFailure() {
        if (state.get() == State.HALF_OPEN) {
            openedAt.set(clock.millis());
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                trialInFlight.set(false);
                logger.warnf("Circuit breaker '%s' transitioning back to OPEN after failed test", name);
                return;
            }
        }

        int failures = consecutiveFailures.incrementAndGet();
        logger.debugf("Circuit breaker '%s' recorded failure %d/%d", name, failures, failureThreshold);

        if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
            openedAt.set(clock.millis());
            logger.errorf("Circuit breaker '%s' OPENED after %d failures", name, failures);
        }
    }

    public State getState() {
        return state.get();
    }

    public int getFailureCount() {
        return consecutiveFailures.get();
    }

    /**
     * Exception thrown when circuit breaker is open.
     */
    public static class CircuitBreakerOpenException extends Exception {
        public CircuitBreakerOpenException(String message) {
            super(message);
        }
    }
}
