package com.ueep.core.health;

import com.ueep.core.resilience.Dependencies;
import com.ueep.core.store.DataStoreClient;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class StoreProbe implements DependencyProbe {
    private final DataStoreClient dataStoreClient;

    public StoreProbe(DataStoreClient dataStoreClient) {
        this.dataStoreClient = dataStoreClient;
    }

    @Override
    public String dependency() {
        return Dependencies.STORE;
    }

    @Override
    public void check() {
        dataStoreClient.ping();
    }
}
