package com.piacp.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piacp.gateway.acp.BridgeContext;
import com.piacp.gateway.pi.PiPaths;
import com.piacp.gateway.pi.PiProcessLauncher;
import com.piacp.gateway.pi.PiRpcProcess;
import com.piacp.gateway.rpc.AcpChannelFactory;
import com.piacp.gateway.rpc.AcpMethodRouter;
import com.piacp.gateway.rpc.AcpMethods;
import com.piacp.gateway.session.SessionDirectory;
import com.piacp.gateway.transport.ConnectionManager;
import com.piacp.gateway.transport.TransportPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for gateway beans.
 */
@Slf4j
@Configuration
public class GatewayBeanConfig {

    @Value("${piacp.transport.max-connections:10}")
    private int maxConnections;
    @Value("${piacp.transport.rate-limit-messages:100}")
    private int rateLimitMessages;
    @Value("${piacp.transport.rate-limit-window-ms:60000}")
    private long rateLimitWindowMs;
    @Value("${piacp.transport.ping-interval-ms:30000}")
    private long pingIntervalMs;
    @Value("${piacp.transport.pong-timeout-ms:10000}")
    private long pongTimeoutMs;
    @Value("${piacp.transport.idle-timeout-ms:300000}")
    private long idleTimeoutMs;
    @Value("${piacp.transport.idle-check-interval-ms:60000}")
    private long idleCheckIntervalMs;
    @Value("${piacp.transport.shutdown-grace-ms:10000}")
    private long shutdownGraceMs;

    @Value("${piacp.pi.command:pi}")
    private String piCommand;
    @Value("${piacp.pi.args:}")
    private String piArgs;

    @Value("${piacp.bridge.user-input-timeout-ms:300000}")
    private long userInputTimeoutMs;
    @Value("${piacp.bridge.session-page-size:50}")
    private int sessionPageSize;

    @Value("${piacp.sessions.dir:}")
    private String sessionsDir;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService piacpScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("piacp-timer-"));
    }

    /** Runs ACP handlers; they may block on the filesystem or on spawning pi. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService piacpWorkers() {
        return Executors.newCachedThreadPool(daemonThreads("piacp-worker-"));
    }

    @Bean
    public TransportPolicy transportPolicy() {
        return TransportPolicy.builder()
                .maxConnections(maxConnections)
                .rateLimitMessages(rateLimitMessages)
                .rateLimitWindowMs(rateLimitWindowMs)
                .pingIntervalMs(pingIntervalMs)
                .pongTimeoutMs(pongTimeoutMs)
                .idleTimeoutMs(idleTimeoutMs)
                .idleCheckIntervalMs(idleCheckIntervalMs)
                .shutdownGraceMs(shutdownGraceMs)
                .build();
    }

    @Bean
    public SessionDirectory sessionDirectory(ObjectMapper objectMapper) {
        Path root = sessionsDir == null || sessionsDir.isBlank()
                ? PiPaths.sessionsDir()
                : PiPaths.expand(sessionsDir);
        log.info("pi sessions directory: {}", root);
        return new SessionDirectory(root, objectMapper);
    }

    @Bean
    public PiProcessLauncher piProcessLauncher(ObjectMapper objectMapper) {
        List<String> extraArgs = piArgs == null || piArgs.isBlank()
                ? List.of()
                : Arrays.asList(piArgs.trim().split("\\s+"));
        return PiRpcProcess.launcher(piCommand, extraArgs, objectMapper);
    }

    @Bean
    public BridgeContext bridgeContext(ObjectMapper objectMapper, SessionDirectory sessionDirectory,
            PiProcessLauncher piProcessLauncher, @Qualifier("piacpScheduler") ScheduledExecutorService piacpScheduler,
            Clock clock) {
        return BridgeContext.builder()
                .mapper(objectMapper)
                .sessions(sessionDirectory)
                .launcher(piProcessLauncher)
                .promptsDir(PiPaths.promptsDir())
                .scheduler(piacpScheduler)
                .clock(clock)
                .userInputTimeoutMs(userInputTimeoutMs)
                .sessionPageSize(sessionPageSize)
                .build();
    }

    @Bean
    public AcpMethodRouter acpMethodRouter() {
        return AcpMethods.createRouter();
    }

    @Bean(initMethod = "start")
    public ConnectionManager connectionManager(TransportPolicy transportPolicy, AcpMethodRouter acpMethodRouter,
            BridgeContext bridgeContext, @Qualifier("piacpWorkers") ExecutorService piacpWorkers,
            ObjectMapper objectMapper, @Qualifier("piacpScheduler") ScheduledExecutorService piacpScheduler,
            Clock clock) {
        AcpChannelFactory channels = new AcpChannelFactory(acpMethodRouter, bridgeContext, piacpWorkers);
        return new ConnectionManager(transportPolicy, channels, objectMapper, piacpScheduler, clock);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
