package com.ueep.core.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IdGeneratorTest {

    @Test
    void keepsWellFormedHeader() {
        assertEquals("abc-123", IdGenerator.resolveCorrelationId("  abc-123 "));
    }

    @Test
    void generatesIdForMissingOrMalformedHeader() {
        assertTrue(IdGenerator.resolveCorrelationId(null).startsWith("cid_"));
        assertTrue(IdGenerator.resolveCorrelationId("has space").startsWith("cid_"));
        assertTrue(IdGenerator.resolveCorrelationId("x".repeat(129)).startsWith("cid_"));
        assertNotEquals(IdGenerator.resolveCorrelationId(""), IdGenerator.resolveCorrelationId(""));
    }
}
