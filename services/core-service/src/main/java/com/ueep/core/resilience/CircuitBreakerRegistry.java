package com.ueep.core.resilience;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class CircuitBreakerRegistry {
    private final Clock clock;
    private final CircuitBreakerListener listener;
    private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
    private volatile Map<String, CircuitBreaker> view = Collections.emptyMap();
    private volatile boolean sealed;

    public CircuitBreakerRegistry(Clock clock) {
        this(clock, CircuitBreakerListener.NOOP);
    }

    public CircuitBreakerRegistry(Clock clock, CircuitBreakerListener listener) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener == null ? CircuitBreakerListener.NOOP : listener;
    }

    public synchronized CircuitBreaker register(String name, CircuitBreakerSettings settings) {
        if (isSealed()) {
            throw new IllegalStateException("Registry is sealed, cannot register '" + name + "'");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("dependency name must not be blank");
        }
        if (breakers.containsKey(name)) {
            throw new DuplicateDependencyException(name);
        }
        CircuitBreaker breaker = new CircuitBreaker(name, settings, clock, listener);
        breakers.put(name, breaker);
        view = Collections.unmodifiableMap(new LinkedHashMap<>(breakers));
        listener.onRegistered(breaker);
        return breaker;
    }

    public synchronized void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public CircuitBreaker get(String name) {
        CircuitBreaker breaker = view.get(name);
        if (breaker == null) {
            throw new UnknownDependencyException(name);
        }
        return breaker;
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(view.keySet()));
    }

    public List<BreakerSnapshot> snapshots() {
        List<BreakerSnapshot> snapshots = new ArrayList<>();
        for (CircuitBreaker breaker : view.values()) {
            snapshots.add(breaker.snapshot());
        }
        return snapshots;
    }
}
