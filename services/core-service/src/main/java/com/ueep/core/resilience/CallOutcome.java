package com.ueep.core.resilience;

import java.util.Locale;

public enum CallOutcome {
    SUCCESS,
    FAILURE,
    REJECTED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
