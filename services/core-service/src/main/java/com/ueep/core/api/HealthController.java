package com.ueep.core.api;

import com.ueep.core.api.dto.HealthResponse;
import com.ueep.core.common.NodeIdentity;
import com.ueep.core.health.DependencyHealth;
import com.ueep.core.health.DependencyStatus;
import com.ueep.core.health.HealthAggregator;
import com.ueep.core.health.HealthVerdict;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final HealthAggregator healthAggregator;
    private final NodeIdentity nodeIdentity;
    private final Clock clock;

    public HealthController(HealthAggregator healthAggregator, NodeIdentity nodeIdentity, Clock clock) {
        this.healthAggregator = healthAggregator;
        this.nodeIdentity = nodeIdentity;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        HealthVerdict verdict = healthAggregator.checkHealth();

        Map<String, String> checks = new LinkedHashMap<>();
        checks.put("service", DependencyStatus.HEALTHY.label());
        Map<String, String> circuits = new LinkedHashMap<>();
        for (DependencyHealth dependency : verdict.dependencies()) {
            checks.put(dependency.dependency(), dependency.status().label());
            circuits.put(dependency.dependency(), dependency.circuitState().label());
        }

        HealthResponse response = new HealthResponse();
        response.setStatus(verdict.overallStatus().label());
        response.setTimestamp(verdict.checkedAt().toString());
        response.setNode(nodeIdentity.getHostname());
        response.setChecks(checks);
        response.setCircuits(circuits);
        HttpStatus status = verdict.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/ready")
    public HealthResponse ready() {
        HealthResponse response = new HealthResponse();
        response.setStatus("ready");
        response.setTimestamp(clock.instant().toString());
        return response;
    }
}
