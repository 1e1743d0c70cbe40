package com.ueep.core.resilience;

import java.util.Objects;

public class RegistryGuardedInvoker implements GuardedInvoker {
    private final CircuitBreakerRegistry registry;

    public RegistryGuardedInvoker(CircuitBreakerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public <T> T invoke(String dependency, GuardedOperation<T> operation) {
        return registry.get(dependency).attemptCall(operation);
    }
}
