package com.ueep.core.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record HealthVerdict(List<DependencyHealth> dependencies, boolean healthy, Instant checkedAt) {

    public HealthVerdict {
        dependencies = List.copyOf(dependencies);
    }

    public static HealthVerdict of(List<DependencyHealth> dependencies, Instant checkedAt) {
        boolean healthy = dependencies.stream().allMatch(DependencyHealth::isHealthy);
        return new HealthVerdict(dependencies, healthy, checkedAt);
    }

    public DependencyStatus overallStatus() {
        return healthy ? DependencyStatus.HEALTHY : DependencyStatus.UNHEALTHY;
    }

    public Map<String, DependencyStatus> statuses() {
        Map<String, DependencyStatus> statuses = new LinkedHashMap<>();
        for (DependencyHealth dependency : dependencies) {
            statuses.put(dependency.dependency(), dependency.status());
        }
        return Collections.unmodifiableMap(statuses);
    }
}
