package com.ueep.core.health;

public interface DependencyProbe {
    String dependency();

    void check() throws Exception;
}
