package com.piacp.gateway.transport;

import lombok.Builder;
import lombok.Getter;

/**
 * Admission, rate and liveness limits applied to every connection.
 */
@Getter
@Builder
public class TransportPolicy {
    @Builder.Default
    private final int maxConnections = 10;
    @Builder.Default
    private final int rateLimitMessages = 100;
    @Builder.Default
    private final long rateLimitWindowMs = 60_000;
    @Builder.Default
    private final long pingIntervalMs = 30_000;
    @Builder.Default
    private final long pongTimeoutMs = 10_000;
    @Builder.Default
    private final long idleTimeoutMs = 5 * 60_000;
    @Builder.Default
    private final long idleCheckIntervalMs = 60_000;
    @Builder.Default
    private final long shutdownGraceMs = 10_000;

    public static TransportPolicy defaults() {
        return TransportPolicy.builder().build();
    }
}
