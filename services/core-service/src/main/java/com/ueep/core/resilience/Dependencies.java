package com.ueep.core.resilience;

import java.util.List;

public final class Dependencies {
    public static final String STORE = "store";
    public static final String CACHE = "cache";

    public static final List<String> ALL = List.of(STORE, CACHE);

    private Dependencies() {
    }
}
