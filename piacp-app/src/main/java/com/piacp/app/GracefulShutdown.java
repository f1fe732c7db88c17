package com.piacp.app;

import com.piacp.gateway.transport.ConnectionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Drains connections when the application context closes (SIGTERM, SIGINT
 * or a programmatic close) and bounds the rest of the teardown: if the
 * process is still alive after the grace period it is halted.
 */
@Slf4j
@Component
public class GracefulShutdown implements ApplicationListener<ContextClosedEvent> {

    private final ConnectionManager connections;
    private final long graceMs;
    private final boolean forceExit;
    private final IntConsumer halt;
    private final AtomicBoolean started = new AtomicBoolean(false);

    @Autowired
    public GracefulShutdown(ConnectionManager connections,
            @Value("${piacp.shutdown.force-exit:true}") boolean forceExit) {
        this(connections, connections.getPolicy().getShutdownGraceMs(), forceExit,
                status -> Runtime.getRuntime().halt(status));
    }

    GracefulShutdown(ConnectionManager connections, long graceMs, boolean forceExit, IntConsumer halt) {
        this.connections = connections;
        this.graceMs = graceMs;
        this.forceExit = forceExit;
        this.halt = halt;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        shutdown();
    }

    void shutdown() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("shutdown: closing {} connections, grace {}ms", connections.getConnectionCount(), graceMs);
        if (forceExit) {
            armWatchdog();
        }
        connections.shutdown();
    }

    private void armWatchdog() {
        Thread watchdog = new Thread(() -> {
            try {
                Thread.sleep(graceMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            log.error("shutdown: still running after {}ms, forcing exit", graceMs);
            halt.accept(1);
        }, "piacp-shutdown-watchdog");
        watchdog.setDaemon(true);
        watchdog.start();
    }
}
