package com.ueep.core.health;

import com.ueep.core.cache.CacheClient;
import com.ueep.core.resilience.Dependencies;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class CacheProbe implements DependencyProbe {
    private final CacheClient cacheClient;

    public CacheProbe(CacheClient cacheClient) {
        this.cacheClient = cacheClient;
    }

    @Override
    public String dependency() {
        return Dependencies.CACHE;
    }

    @Override
    public void check() {
        cacheClient.ping();
    }
}
