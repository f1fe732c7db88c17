package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piacp.gateway.pi.PiProcessLauncher;
import com.piacp.gateway.session.SessionDirectory;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators shared by every connection's {@link AcpAgent}.
 */
@Getter
@Builder
public class BridgeContext {

    private final ObjectMapper mapper;
    private final SessionDirectory sessions;
    private final PiProcessLauncher launcher;
    /** pi's global prompt-template directory. */
    private final Path promptsDir;
    private final ScheduledExecutorService scheduler;
    @Builder.Default
    private final Clock clock = Clock.systemUTC();
    @Builder.Default
    private final long userInputTimeoutMs = 300_000;
    @Builder.Default
    private final int sessionPageSize = 50;
    @Builder.Default
    private final String agentName = "pi-acp";
    @Builder.Default
    private final String agentVersion = "0.1.0";
}
