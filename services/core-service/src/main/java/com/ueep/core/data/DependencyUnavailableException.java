package com.ueep.core.data;

import com.ueep.core.resilience.DependencyException;

public class DependencyUnavailableException extends DependencyException {
    public DependencyUnavailableException(String dependency, String message, Throwable cause) {
        super(dependency, message, cause);
    }
}
