package com.ueep.core.health;

import com.ueep.core.resilience.CircuitState;

public record DependencyHealth(String dependency, DependencyStatus status, CircuitState circuitState, String detail) {

    public boolean isHealthy() {
        return status == DependencyStatus.HEALTHY;
    }
}
