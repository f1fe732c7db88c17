package com.piacp.gateway.session;

import java.nio.file.Path;

/**
 * Listing projection of one session log file. Recomputed on every listing;
 * {@code title} and {@code updatedAt} may be null when nothing was recoverable.
 */
public record SessionListing(
        String sessionId,
        String cwd,
        String title,
        String updatedAt,
        Path sessionFile) {
}
