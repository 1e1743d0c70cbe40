package com.ueep.core.resilience;

public abstract class DependencyException extends RuntimeException {
    private final String dependency;

    protected DependencyException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    protected DependencyException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
