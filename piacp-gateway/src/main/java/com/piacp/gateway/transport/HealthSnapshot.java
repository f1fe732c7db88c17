package com.piacp.gateway.transport;

/**
 * Body of {@code GET /health}.
 *
 * @param uptime seconds since the server started
 */
public record HealthSnapshot(String status, int connections, int maxConnections, long uptime, String timestamp) {
}
