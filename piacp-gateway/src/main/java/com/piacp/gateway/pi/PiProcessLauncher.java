package com.piacp.gateway.pi;

/**
 * Starts a pi process bound to a working directory / session log.
 */
@FunctionalInterface
public interface PiProcessLauncher {

    PiProcess spawn(PiSpawnRequest request);
}
