package com.ueep.core.data;

public record FetchResult(String key, String value, DataSourceTag source) {
}
