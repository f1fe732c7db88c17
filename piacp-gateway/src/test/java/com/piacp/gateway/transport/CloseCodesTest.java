package com.piacp.gateway.transport;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CloseCodesTest {

    @Test
    void shortReasonsAreKept() {
        assertEquals("Idle timeout", CloseCodes.truncate("Idle timeout"));
        assertEquals("", CloseCodes.truncate(null));
    }

    @Test
    void longReasonsAreCutToTheByteLimit() {
        String reason = "x".repeat(300);
        assertEquals(CloseCodes.CLOSE_REASON_MAX_BYTES, CloseCodes.truncate(reason).length());
    }

    @Test
    void multiByteCharactersAreNotSplit() {
        // 3 bytes each in UTF-8; 120 is a multiple of 3, so shift by one
        String reason = "a" + "\u20AC".repeat(60);
        String truncated = CloseCodes.truncate(reason);

        byte[] bytes = truncated.getBytes(StandardCharsets.UTF_8);
        assertTrue(bytes.length <= CloseCodes.CLOSE_REASON_MAX_BYTES);
        assertEquals(1 + 39, truncated.length());
        assertFalse(truncated.contains("\uFFFD"));
    }
}
