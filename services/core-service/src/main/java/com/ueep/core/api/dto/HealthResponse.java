package com.ueep.core.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {
    private String status;
    private String timestamp;
    private String node;
    private Map<String, String> checks;
    private Map<String, String> circuits;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getNode() {
        return node;
    }

    public void setNode(String node) {
        this.node = node;
    }

    public Map<String, String> getChecks() {
        return checks;
    }

    public void setChecks(Map<String, String> checks) {
        this.checks = checks;
    }

    public Map<String, String> getCircuits() {
        return circuits;
    }

    public void setCircuits(Map<String, String> circuits) {
        this.circuits = circuits;
    }
}
