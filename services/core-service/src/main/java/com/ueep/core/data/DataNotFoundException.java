package com.ueep.core.data;

public class DataNotFoundException extends RuntimeException {

    public DataNotFoundException(String key) {
        super("No value stored for key '" + key + "'");
    }
}
