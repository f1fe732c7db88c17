package com.piacp.gateway.pi;

import java.nio.file.Path;

/**
 * What to start pi with: the working directory and, when attaching to an
 * existing conversation, its session log file (null for a new session).
 */
public record PiSpawnRequest(String cwd, Path sessionPath) {

    public static PiSpawnRequest newSession(String cwd) {
        return new PiSpawnRequest(cwd, null);
    }

    public static PiSpawnRequest attach(String cwd, Path sessionPath) {
        return new PiSpawnRequest(cwd, sessionPath);
    }
}
