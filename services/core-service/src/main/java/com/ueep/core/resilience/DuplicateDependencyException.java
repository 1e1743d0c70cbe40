package com.ueep.core.resilience;

public class DuplicateDependencyException extends RuntimeException {
    public DuplicateDependencyException(String dependency) {
        super("Circuit breaker already registered for dependency '" + dependency + "'");
    }
}
