package com.ueep.core.resilience;

import java.util.Locale;

public enum CircuitState {
    CLOSED(0),
    OPEN(1),
    HALF_OPEN(2);

    private final int metricValue;

    CircuitState(int metricValue) {
        this.metricValue = metricValue;
    }

    public int getMetricValue() {
        return metricValue;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
