package com.ueep.core.resilience;

@FunctionalInterface
public interface GuardedOperation<T> {
    T call() throws Exception;
}
