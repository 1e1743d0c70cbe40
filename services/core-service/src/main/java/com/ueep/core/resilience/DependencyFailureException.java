package com.ueep.core.resilience;

public class DependencyFailureException extends DependencyException {
    public DependencyFailureException(String dependency, Throwable cause) {
        super(dependency, "dependency_failure dependency=" + dependency + " cause=" + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : cause.getClass().getSimpleName() + ": " + message;
    }
}
