package com.piacp.gateway.transport;

import java.nio.charset.StandardCharsets;

/**
 * WebSocket close codes used by connection policy, and close-reason
 * truncation.
 */
public final class CloseCodes {

    private CloseCodes() {
    }

    public static final int SHUTDOWN = 1001;
    public static final int RATE_LIMITED = 1008;
    public static final int PING_FAILED = 1011;
    public static final int OVERLOADED = 1013;
    public static final int IDLE_TIMEOUT = 4000;
    public static final int PING_TIMEOUT = 4001;
    public static final int PONG_TIMEOUT = 4002;

    /** Close frames carry at most 123 bytes of reason; keep a margin. */
    public static final int CLOSE_REASON_MAX_BYTES = 120;

    /**
     * Truncate a reason so that its UTF-8 form fits in
     * {@link #CLOSE_REASON_MAX_BYTES}, without splitting a character.
     */
    public static String truncate(String reason) {
        if (reason == null || reason.isEmpty()) {
            return "";
        }
        byte[] encoded = reason.getBytes(StandardCharsets.UTF_8);
        if (encoded.length <= CLOSE_REASON_MAX_BYTES) {
            return reason;
        }
        int end = CLOSE_REASON_MAX_BYTES;
        // back off continuation bytes (10xxxxxx)
        while (end > 0 && (encoded[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(encoded, 0, end, StandardCharsets.UTF_8);
    }
}
