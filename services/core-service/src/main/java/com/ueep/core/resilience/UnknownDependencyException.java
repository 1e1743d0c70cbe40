package com.ueep.core.resilience;

public class UnknownDependencyException extends RuntimeException {
    public UnknownDependencyException(String dependency) {
        super("No circuit breaker registered for dependency '" + dependency + "'");
    }
}
