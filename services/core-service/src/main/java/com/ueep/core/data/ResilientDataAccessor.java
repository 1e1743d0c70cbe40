package com.ueep.core.data;

import com.ueep.core.cache.CacheClient;
import com.ueep.core.config.DataProperties;
import com.ueep.core.metrics.ResilienceMetrics;
import com.ueep.core.resilience.CircuitOpenException;
import com.ueep.core.resilience.Dependencies;
import com.ueep.core.resilience.DependencyException;
import com.ueep.core.resilience.GuardedInvoker;
import com.ueep.core.store.DataStoreClient;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResilientDataAccessor {
    private static final Logger logger = LoggerFactory.getLogger(ResilientDataAccessor.class);

    private final GuardedInvoker guardedInvoker;
    private final CacheClient cacheClient;
    private final DataStoreClient dataStoreClient;
    private final DataProperties properties;
    private final ResilienceMetrics metrics;

    public ResilientDataAccessor(
        GuardedInvoker guardedInvoker,
        CacheClient cacheClient,
        DataStoreClient dataStoreClient,
        DataProperties properties,
        ResilienceMetrics metrics
    ) {
        this.guardedInvoker = guardedInvoker;
        this.cacheClient = cacheClient;
        this.dataStoreClient = dataStoreClient;
        this.properties = properties;
        this.metrics = metrics;
    }

    public FetchResult fetch(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        String cacheKey = cacheKey(key);

        Optional<String> cached = readCache(cacheKey);
        if (cached.isPresent()) {
            return new FetchResult(key, cached.get(), DataSourceTag.CACHE);
        }

        Optional<String> stored;
        try {
            stored = guardedInvoker.invoke(Dependencies.STORE, () -> dataStoreClient.readValue(key));
        } catch (DependencyException ex) {
            String status = ex instanceof CircuitOpenException ? "rejected" : "error";
            metrics.recordDatabaseOperation("select", status);
            logger.error("store_read_failed key={} status={} error={}", key, status, ex.getMessage());
            throw new DependencyUnavailableException(Dependencies.STORE, "Service temporarily unavailable", ex);
        }

        if (stored.isEmpty()) {
            metrics.recordDatabaseOperation("select", "not_found");
            throw new DataNotFoundException(key);
        }
        metrics.recordDatabaseOperation("select", "success");

        String value = stored.get();
        writeCache(cacheKey, value);
        return new FetchResult(key, value, DataSourceTag.STORE);
    }

    private Optional<String> readCache(String cacheKey) {
        try {
            Optional<String> cached = guardedInvoker.invoke(Dependencies.CACHE, () -> cacheClient.get(cacheKey));
            metrics.recordCacheOperation("get", cached.isPresent() ? "hit" : "miss");
            return cached;
        } catch (DependencyException ex) {
            metrics.recordCacheOperation("get", "error");
            logger.warn("cache_read_failed key={} error={}", cacheKey, ex.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String cacheKey, String value) {
        try {
            guardedInvoker.invoke(Dependencies.CACHE, () -> {
                cacheClient.set(cacheKey, value, properties.getCacheTtl());
                return Boolean.TRUE;
            });
            metrics.recordCacheOperation("set", "success");
        } catch (DependencyException ex) {
            metrics.recordCacheOperation("set", "error");
            logger.warn("cache_write_failed key={} error={}", cacheKey, ex.getMessage());
        }
    }

    private String cacheKey(String key) {
        String prefix = properties.getKeyPrefix();
        return prefix == null ? key : prefix + key;
    }
}
