package com.ueep.core.health;

import java.util.Locale;

public enum DependencyStatus {
    HEALTHY,
    UNHEALTHY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
