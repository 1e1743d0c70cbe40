package com.ueep.core.config;

import com.ueep.core.metrics.ResilienceMetrics;
import com.ueep.core.resilience.BreakerSnapshot;
import com.ueep.core.resilience.CircuitBreakerRegistry;
import com.ueep.core.resilience.Dependencies;
import com.ueep.core.resilience.GuardedInvoker;
import com.ueep.core.resilience.RegistryGuardedInvoker;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {
    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
        ResilienceProperties properties,
        Clock clock,
        ResilienceMetrics resilienceMetrics
    ) {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(clock, resilienceMetrics);
        for (String dependency : Dependencies.ALL) {
            registry.register(dependency, properties.settingsFor(dependency));
        }
        registry.seal();
        for (BreakerSnapshot snapshot : registry.snapshots()) {
            logger.info(
                "circuit_registered dependency={} failure_threshold={} recovery_timeout_ms={}",
                snapshot.name(),
                snapshot.failureThreshold(),
                snapshot.recoveryTimeout().toMillis()
            );
        }
        return registry;
    }

    @Bean
    public GuardedInvoker guardedInvoker(CircuitBreakerRegistry circuitBreakerRegistry) {
        return new RegistryGuardedInvoker(circuitBreakerRegistry);
    }
}
