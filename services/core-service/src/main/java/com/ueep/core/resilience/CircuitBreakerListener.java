package com.ueep.core.resilience;

public interface CircuitBreakerListener {
    CircuitBreakerListener NOOP = new CircuitBreakerListener() {
    };

    default void onRegistered(CircuitBreaker breaker) {
    }

    default void onStateTransition(String dependency, CircuitState from, CircuitState to) {
    }

    default void onCallOutcome(String dependency, CallOutcome outcome) {
    }
}
