package com.ueep.core.health;

import com.ueep.core.metrics.ResilienceMetrics;
import com.ueep.core.resilience.CircuitBreakerRegistry;
import com.ueep.core.resilience.CircuitOpenException;
import com.ueep.core.resilience.DependencyFailureException;
import com.ueep.core.resilience.GuardedInvoker;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class HealthAggregator {
    private static final Logger logger = LoggerFactory.getLogger(HealthAggregator.class);

    private final CircuitBreakerRegistry registry;
    private final GuardedInvoker guardedInvoker;
    private final Map<String, DependencyProbe> probes;
    private final ResilienceMetrics metrics;
    private final Clock clock;

    public HealthAggregator(
        CircuitBreakerRegistry registry,
        GuardedInvoker guardedInvoker,
        List<DependencyProbe> probes,
        ResilienceMetrics metrics,
        Clock clock
    ) {
        this.registry = registry;
        this.guardedInvoker = guardedInvoker;
        this.metrics = metrics;
        this.clock = clock;
        this.probes = new LinkedHashMap<>();
        for (DependencyProbe probe : probes) {
            // fails startup for a probe whose dependency has no breaker
            registry.get(probe.dependency());
            this.probes.put(probe.dependency(), probe);
        }
    }

    public HealthVerdict checkHealth() {
        List<DependencyHealth> results = new ArrayList<>();
        for (String dependency : registry.names()) {
            DependencyHealth health = checkOne(dependency);
            metrics.recordHealth(dependency, health.isHealthy());
            results.add(health);
        }
        return HealthVerdict.of(results, clock.instant());
    }

    private DependencyHealth checkOne(String dependency) {
        DependencyProbe probe = probes.get(dependency);
        if (probe == null) {
            logger.warn("health_probe_missing dependency={}", dependency);
            return unhealthy(dependency, "probe_missing");
        }
        try {
            guardedInvoker.invoke(dependency, () -> {
                probe.check();
                return Boolean.TRUE;
            });
            return new DependencyHealth(
                dependency,
                DependencyStatus.HEALTHY,
                registry.get(dependency).getState(),
                "ok"
            );
        } catch (CircuitOpenException ex) {
            logger.warn("health_check_rejected dependency={} state={}", dependency, ex.getCircuitState().label());
            return unhealthy(dependency, "circuit_open");
        } catch (DependencyFailureException ex) {
            logger.error("health_check_failed dependency={} error={}", dependency, describe(ex.getCause()));
            return unhealthy(dependency, describe(ex.getCause()));
        } catch (RuntimeException ex) {
            logger.error("health_check_error dependency={}", dependency, ex);
            return unhealthy(dependency, describe(ex));
        }
    }

    private DependencyHealth unhealthy(String dependency, String detail) {
        return new DependencyHealth(dependency, DependencyStatus.UNHEALTHY, registry.get(dependency).getState(), detail);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown_error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
