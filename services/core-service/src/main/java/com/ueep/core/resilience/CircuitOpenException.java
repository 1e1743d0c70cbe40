package com.ueep.core.resilience;

public class CircuitOpenException extends DependencyException {
    private final CircuitState circuitState;

    public CircuitOpenException(String dependency, CircuitState circuitState) {
        super(dependency, "circuit_open dependency=" + dependency + " state=" + circuitState.label());
        this.circuitState = circuitState;
    }

    public CircuitState getCircuitState() {
        return circuitState;
    }
}
