package com.ueep.core.resilience;

public interface GuardedInvoker {
    <T> T invoke(String dependency, GuardedOperation<T> operation);
}
