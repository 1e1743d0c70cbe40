package com.ueep.core.data;

import java.util.Locale;

public enum DataSourceTag {
    CACHE,
    STORE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
