package com.ueep.core.resilience;

import java.time.Duration;
import java.time.Instant;

public record BreakerSnapshot(
    String name,
    CircuitState state,
    int failureCount,
    Instant lastFailureTime,
    int failureThreshold,
    Duration recoveryTimeout
) {
}
