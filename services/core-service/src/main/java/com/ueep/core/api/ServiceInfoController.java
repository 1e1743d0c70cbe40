package com.ueep.core.api;

import com.ueep.core.common.NodeIdentity;
import com.ueep.core.config.ServiceProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ServiceInfoController {
    private final ServiceProperties properties;
    private final NodeIdentity nodeIdentity;
    private final Clock clock;
    private final AtomicLong requestCount = new AtomicLong(0);

    public ServiceInfoController(ServiceProperties properties, NodeIdentity nodeIdentity, Clock clock) {
        this.properties = properties;
        this.nodeIdentity = nodeIdentity;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, Object> info() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", properties.getName());
        response.put("version", properties.getVersion());
        response.put("environment", properties.getEnvironment());
        response.put("node", nodeIdentity.getHostname());
        response.put("timestamp", clock.instant().toString());
        response.put("request_count", requestCount.incrementAndGet());
        response.put("status", "operational");
        return response;
    }
}
