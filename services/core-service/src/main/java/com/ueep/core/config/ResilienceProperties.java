package com.ueep.core.config;

import com.ueep.core.resilience.CircuitBreakerSettings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ueep.resilience")
public class ResilienceProperties {
    private int failureThreshold = 5;
    private Duration recoveryTimeout = Duration.ofSeconds(30);
    private Map<String, DependencyOverride> dependencies = new LinkedHashMap<>();

    public CircuitBreakerSettings settingsFor(String dependency) {
        DependencyOverride override = dependencies == null ? null : dependencies.get(dependency);
        int threshold = failureThreshold;
        Duration timeout = recoveryTimeout;
        if (override != null) {
            if (override.getFailureThreshold() != null) {
                threshold = override.getFailureThreshold();
            }
            if (override.getRecoveryTimeout() != null) {
                timeout = override.getRecoveryTimeout();
            }
        }
        return new CircuitBreakerSettings(threshold, timeout);
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public void setRecoveryTimeout(Duration recoveryTimeout) {
        this.recoveryTimeout = recoveryTimeout;
    }

    public Map<String, DependencyOverride> getDependencies() {
        return dependencies;
    }

    public void setDependencies(Map<String, DependencyOverride> dependencies) {
        this.dependencies = dependencies;
    }

    public static class DependencyOverride {
        private Integer failureThreshold;
        private Duration recoveryTimeout;

        public Integer getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(Integer failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }
    }
}
