package com.ueep.core.metrics;

import com.ueep.core.resilience.CallOutcome;
import com.ueep.core.resilience.CircuitBreaker;
import com.ueep.core.resilience.CircuitBreakerListener;
import com.ueep.core.resilience.CircuitState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
public class ResilienceMetrics implements CircuitBreakerListener {
    static final String BREAKER_STATE = "ueep.circuit.breaker.state";
    static final String BREAKER_CALLS = "ueep.circuit.breaker.calls";
    static final String BREAKER_TRANSITIONS = "ueep.circuit.breaker.transitions";
    static final String HEALTH_STATUS = "ueep.health.status";
    static final String CACHE_OPERATIONS = "ueep.cache.operations";
    static final String DATABASE_OPERATIONS = "ueep.database.operations";

    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, AtomicInteger> healthGauges = new ConcurrentHashMap<>();

    public ResilienceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onRegistered(CircuitBreaker breaker) {
        Gauge.builder(BREAKER_STATE, breaker, b -> b.getState().getMetricValue())
            .description("Circuit breaker state (0 = closed, 1 = open, 2 = half-open)")
            .tag("circuit", breaker.getName())
            .register(meterRegistry);
    }

    @Override
    public void onStateTransition(String dependency, CircuitState from, CircuitState to) {
        meterRegistry.counter(BREAKER_TRANSITIONS, "circuit", dependency, "from", from.label(), "to", to.label())
            .increment();
    }

    @Override
    public void onCallOutcome(String dependency, CallOutcome outcome) {
        meterRegistry.counter(BREAKER_CALLS, "circuit", dependency, "outcome", outcome.tag()).increment();
    }

    public void recordHealth(String component, boolean healthy) {
        AtomicInteger gauge = healthGauges.computeIfAbsent(component, key -> {
            AtomicInteger holder = new AtomicInteger(0);
            Gauge.builder(HEALTH_STATUS, holder, AtomicInteger::get)
                .description("Health status (1 = healthy, 0 = unhealthy)")
                .tag("component", key)
                .register(meterRegistry);
            return holder;
        });
        gauge.set(healthy ? 1 : 0);
    }

    public void recordCacheOperation(String operation, String status) {
        meterRegistry.counter(CACHE_OPERATIONS, "operation", operation, "status", status).increment();
    }

    public void recordDatabaseOperation(String operation, String status) {
        meterRegistry.counter(DATABASE_OPERATIONS, "operation", operation, "status", status).increment();
    }
}
