package com.ueep.core.common;

import java.util.UUID;

public final class IdGenerator {
    private static final int MAX_CORRELATION_ID_LENGTH = 128;

    private IdGenerator() {
    }

    public static String resolveCorrelationId(String headerValue) {
        if (headerValue != null) {
            String trimmed = headerValue.trim();
            if (!trimmed.isEmpty() && trimmed.length() <= MAX_CORRELATION_ID_LENGTH && isPrintable(trimmed)) {
                return trimmed;
            }
        }
        return "cid_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static boolean isPrintable(String value) {
        return value.chars().allMatch(ch -> ch >= 0x21 && ch <= 0x7e);
    }
}
