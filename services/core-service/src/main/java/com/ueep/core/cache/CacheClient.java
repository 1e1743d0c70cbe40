package com.ueep.core.cache;

import java.time.Duration;
import java.util.Optional;

public interface CacheClient {
    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void ping();
}
