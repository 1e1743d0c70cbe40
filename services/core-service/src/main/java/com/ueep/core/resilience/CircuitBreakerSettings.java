package com.ueep.core.resilience;

import java.time.Duration;
import java.util.Objects;

public record CircuitBreakerSettings(int failureThreshold, Duration recoveryTimeout) {

    public CircuitBreakerSettings {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive, got " + recoveryTimeout);
        }
    }
}
