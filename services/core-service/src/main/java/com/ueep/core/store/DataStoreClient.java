package com.ueep.core.store;

import java.util.Optional;

public interface DataStoreClient {
    void ping();

    Optional<String> readValue(String key);
}
