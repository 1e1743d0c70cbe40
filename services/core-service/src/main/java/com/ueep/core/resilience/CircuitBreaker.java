package com.ueep.core.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-dependency circuit breaker.
 *
 * <p>CLOSED lets calls through and counts consecutive failures. Reaching the threshold trips the
 * circuit to OPEN, which rejects calls without running them until {@code recoveryTimeout} has passed
 * since the last executed failure. The first caller after that becomes the HALF_OPEN trial: its success
 * closes the circuit, its failure re-opens it. While the trial is in flight every other caller is
 * rejected.
 *
 * <p>State reads and transitions happen under a per-breaker monitor. The guarded operation itself runs
 * outside it, so slow dependency I/O never serializes callers.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final CircuitBreakerListener listener;
    private final Object lock = new Object();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
        this(name, settings, clock, CircuitBreakerListener.NOOP);
    }

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock, CircuitBreakerListener listener) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(settings, "settings");
        this.failureThreshold = settings.failureThreshold();
        this.recoveryTimeout = settings.recoveryTimeout();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener == null ? CircuitBreakerListener.NOOP : listener;
    }

    public <T> T attemptCall(GuardedOperation<T> operation) {
        Objects.requireNonNull(operation, "operation");
        boolean trial = acquirePermit();
        T result;
        try {
            result = operation.call();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            recordFailure(trial);
            throw new DependencyFailureException(name, ex);
        } catch (Exception ex) {
            recordFailure(trial);
            throw new DependencyFailureException(name, ex);
        } catch (Error err) {
            recordFailure(trial);
            throw err;
        }
        recordSuccess(trial);
        return result;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }

    public BreakerSnapshot snapshot() {
        synchronized (lock) {
            return new BreakerSnapshot(name, state, failureCount, lastFailureTime, failureThreshold, recoveryTimeout);
        }
    }

    // true when the caller holds the trial slot
    private boolean acquirePermit() {
        CircuitState rejectedIn = null;
        boolean trial = false;
        synchronized (lock) {
            if (state == CircuitState.HALF_OPEN) {
                rejectedIn = CircuitState.HALF_OPEN;
            } else if (state == CircuitState.OPEN) {
                Duration elapsed = Duration.between(lastFailureTime, clock.instant());
                if (elapsed.compareTo(recoveryTimeout) < 0) {
                    rejectedIn = CircuitState.OPEN;
                } else {
                    state = CircuitState.HALF_OPEN;
                    trial = true;
                }
            }
        }

        if (rejectedIn != null) {
            logger.debug("circuit_reject dependency={} state={}", name, rejectedIn.label());
            notifyOutcome(CallOutcome.REJECTED);
            throw new CircuitOpenException(name, rejectedIn);
        }
        if (trial) {
            logger.info("circuit_half_open dependency={} recovery_timeout_ms={}", name, recoveryTimeout.toMillis());
            notifyTransition(CircuitState.OPEN, CircuitState.HALF_OPEN);
        }
        return trial;
    }

    private void recordSuccess(boolean trial) {
        boolean closed = false;
        synchronized (lock) {
            if (trial) {
                if (state == CircuitState.HALF_OPEN) {
                    state = CircuitState.CLOSED;
                    failureCount = 0;
                    lastFailureTime = null;
                    closed = true;
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
                lastFailureTime = null;
            }
        }

        if (closed) {
            logger.info("circuit_closed dependency={}", name);
            notifyTransition(CircuitState.HALF_OPEN, CircuitState.CLOSED);
        }
        notifyOutcome(CallOutcome.SUCCESS);
    }

    private void recordFailure(boolean trial) {
        CircuitState tripped = null;
        int failures;
        synchronized (lock) {
            failureCount++;
            lastFailureTime = clock.instant();
            failures = failureCount;
            boolean trialFailed = trial && state == CircuitState.HALF_OPEN;
            boolean thresholdReached = state == CircuitState.CLOSED && failureCount >= failureThreshold;
            if (trialFailed || thresholdReached) {
                tripped = state;
                state = CircuitState.OPEN;
            }
        }

        if (tripped != null) {
            logger.error(
                "circuit_opened dependency={} from={} failures={} threshold={}",
                name,
                tripped.label(),
                failures,
                failureThreshold
            );
            notifyTransition(tripped, CircuitState.OPEN);
        }
        notifyOutcome(CallOutcome.FAILURE);
    }

    private void notifyTransition(CircuitState from, CircuitState to) {
        try {
            listener.onStateTransition(name, from, to);
        } catch (RuntimeException ex) {
            logger.warn("circuit_listener_failed dependency={} event=transition error={}", name, ex.getMessage());
        }
    }

    private void notifyOutcome(CallOutcome outcome) {
        try {
            listener.onCallOutcome(name, outcome);
        } catch (RuntimeException ex) {
            logger.warn("circuit_listener_failed dependency={} event=outcome error={}", name, ex.getMessage());
        }
    }
}
