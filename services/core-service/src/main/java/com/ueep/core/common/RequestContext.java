package com.ueep.core.common;

public class RequestContext {
    private final String correlationId;
    private final long startedAtNs;

    public RequestContext(String correlationId, long startedAtNs) {
        this.correlationId = correlationId;
        this.startedAtNs = startedAtNs;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public long getStartedAtNs() {
        return startedAtNs;
    }
}
