package com.piacp.gateway.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns every open connection: admission control, per-connection rate
 * limiting, ping/pong liveness, idle eviction and shutdown drain.
 *
 * <p>
 * Transport-agnostic: sockets come in as {@link TransportSocket}, and each
 * admitted connection gets a {@link MessageChannel} from the
 * {@link ChannelFactory}. Timers run on the injected scheduler and read time
 * from the injected clock.
 *
 * <p>
 * Lifecycle: {@link #start()} arms the periodic heartbeat and idle checks,
 * {@link #shutdown()} cancels them and closes every connection.
 */
@Slf4j
public class ConnectionManager {

    private final TransportPolicy policy;
    private final ChannelFactory channels;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long startedAtMs;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final List<ScheduledFuture<?>> periodic = new ArrayList<>();
    private volatile boolean shuttingDown;

    public ConnectionManager(TransportPolicy policy, ChannelFactory channels, ObjectMapper mapper,
            ScheduledExecutorService scheduler, Clock clock) {
        this.policy = policy;
        this.channels = channels;
        this.mapper = mapper;
        this.scheduler = scheduler;
        this.clock = clock;
        this.startedAtMs = clock.millis();
    }

    public TransportPolicy getPolicy() {
        return policy;
    }

    public synchronized void start() {
        if (!periodic.isEmpty()) {
            return;
        }
        periodic.add(scheduler.scheduleAtFixedRate(this::runHeartbeat,
                policy.getPingIntervalMs(), policy.getPingIntervalMs(), TimeUnit.MILLISECONDS));
        periodic.add(scheduler.scheduleAtFixedRate(this::runIdleCheck,
                policy.getIdleCheckIntervalMs(), policy.getIdleCheckIntervalMs(), TimeUnit.MILLISECONDS));
        log.info("ws:policy maxConnections={} rate={}/{}ms ping={}ms pong={}ms idle={}ms",
                policy.getMaxConnections(), policy.getRateLimitMessages(), policy.getRateLimitWindowMs(),
                policy.getPingIntervalMs(), policy.getPongTimeoutMs(), policy.getIdleTimeoutMs());
    }

    // ── Socket events ───────────────────────────────────────────

    /**
     * Admit a freshly opened socket, or close it straight away when the
     * server is full or shutting down.
     *
     * @return true if admitted
     */
    public boolean accept(TransportSocket socket) {
        Connection connection;
        synchronized (this) {
            if (shuttingDown) {
                socket.close(CloseCodes.SHUTDOWN, "Server shutting down");
                return false;
            }
            if (connections.size() >= policy.getMaxConnections()) {
                log.info("ws:reject conn={} remote={} reason=max-connections({})",
                        socket.id(), socket.remoteAddress(), policy.getMaxConnections());
                socket.close(CloseCodes.OVERLOADED, "Server overloaded");
                return false;
            }
            connection = new Connection(socket.id(), socket, clock.millis());
            connections.put(connection.getId(), connection);
        }
        String id = connection.getId();
        connection.bind(channels.open(id, text -> send(id, text)));
        log.info("ws:open conn={} remote={} total={}", id, socket.remoteAddress(), connections.size());
        return true;
    }

    /**
     * Inbound text frame. Rate limiting applies before anything else; frames
     * that are not JSON, and JSON {@code ping}/{@code pong} keepalives, are
     * dropped.
     */
    public void onMessage(String connectionId, String text) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return;
        }
        long now = clock.millis();
        connection.touch(now);

        if (connection.countMessage(now, policy.getRateLimitMessages(), policy.getRateLimitWindowMs())) {
            log.info("ws:rate-limit conn={} limit={}/{}ms", connectionId,
                    policy.getRateLimitMessages(), policy.getRateLimitWindowMs());
            close(connection, CloseCodes.RATE_LIMITED, "Rate limit exceeded");
            return;
        }

        JsonNode message;
        try {
            message = mapper.readTree(text);
        } catch (IOException e) {
            log.debug("ws:drop conn={} malformed frame: {}", connectionId, e.getMessage());
            return;
        }
        if (message == null || !message.isContainerNode()) {
            log.debug("ws:drop conn={} non-object frame", connectionId);
            return;
        }
        String type = message.path("type").asText("");
        if ("ping".equals(type) || "pong".equals(type)) {
            return;
        }
        MessageChannel channel = connection.channel();
        if (channel != null) {
            channel.onMessage(message);
        }
    }

    /** Protocol-level pong received. */
    public void onPong(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return;
        }
        connection.markAlive();
        connection.touch(clock.millis());
    }

    /** The socket closed, from either side. */
    public void onClose(String connectionId, int code, String reason) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        release(connection);
        log.info("ws:close conn={} code={} reason={} total={}", connectionId, code, reason, connections.size());
    }

    /** Write a text frame; counts as activity. */
    public void send(String connectionId, String text) {
        Connection connection = connections.get(connectionId);
        if (connection == null || !connection.socket().isOpen()) {
            log.debug("ws:out dropped, conn={} is gone", connectionId);
            return;
        }
        connection.touch(clock.millis());
        try {
            connection.socket().send(text);
        } catch (IOException e) {
            log.warn("ws:out conn={} send failed: {}", connectionId, e.getMessage());
        }
    }

    // ── Periodic passes ─────────────────────────────────────────

    /**
     * Close connections that left the previous probe unanswered, then probe
     * the rest and arm a pong timer for each.
     */
    void runHeartbeat() {
        for (Connection connection : List.copyOf(connections.values())) {
            if (!connection.isAlive()) {
                log.info("ws:ping-timeout conn={}", connection.getId());
                close(connection, CloseCodes.PING_TIMEOUT, "Ping timeout");
                continue;
            }
            try {
                connection.probeSent(null);
                connection.socket().sendPing();
            } catch (IOException | RuntimeException e) {
                log.info("ws:ping-failed conn={}: {}", connection.getId(), e.getMessage());
                close(connection, CloseCodes.PING_FAILED, "Ping failed");
                continue;
            }
            ScheduledFuture<?> timer = scheduler.schedule(() -> onPongTimeout(connection),
                    policy.getPongTimeoutMs(), TimeUnit.MILLISECONDS);
            synchronized (connection) {
                if (connection.isAlive()) {
                    // pong already arrived
                    timer.cancel(false);
                } else {
                    connection.probeSent(timer);
                }
            }
        }
    }

    private void onPongTimeout(Connection connection) {
        // the connection may have been closed by another path meanwhile
        if (connections.get(connection.getId()) != connection || connection.isAlive()) {
            return;
        }
        log.info("ws:pong-timeout conn={} after {}ms", connection.getId(), policy.getPongTimeoutMs());
        close(connection, CloseCodes.PONG_TIMEOUT, "Pong timeout");
    }

    /** Close connections with no traffic in either direction for too long. */
    void runIdleCheck() {
        long now = clock.millis();
        for (Connection connection : List.copyOf(connections.values())) {
            long idleMs = now - connection.getLastActivityMs();
            if (idleMs > policy.getIdleTimeoutMs()) {
                log.info("ws:idle conn={} idle={}s", connection.getId(), idleMs / 1000);
                close(connection, CloseCodes.IDLE_TIMEOUT, "Idle timeout");
            }
        }
    }

    // ── Shutdown ────────────────────────────────────────────────

    /**
     * Stop the periodic passes and close every connection with the shutdown
     * code. New sockets are refused from here on.
     */
    public void shutdown() {
        List<ScheduledFuture<?>> timers;
        synchronized (this) {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            timers = List.copyOf(periodic);
            periodic.clear();
        }
        for (ScheduledFuture<?> timer : timers) {
            timer.cancel(false);
        }
        List<Connection> open = List.copyOf(connections.values());
        log.info("ws:shutdown closing {} connections", open.size());
        for (Connection connection : open) {
            close(connection, CloseCodes.SHUTDOWN, "Server shutting down");
        }
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    // ── Introspection ───────────────────────────────────────────

    public int getConnectionCount() {
        return connections.size();
    }

    public boolean isOpen(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public HealthSnapshot health() {
        long now = clock.millis();
        return new HealthSnapshot("healthy", connections.size(), policy.getMaxConnections(),
                (now - startedAtMs) / 1000, Instant.ofEpochMilli(now).toString());
    }

    // ── Internals ───────────────────────────────────────────────

    private void close(Connection connection, int code, String reason) {
        // only the first remover tears the connection down
        if (!connections.remove(connection.getId(), connection)) {
            return;
        }
        release(connection);
        connection.socket().close(code, CloseCodes.truncate(reason));
    }

    private void release(Connection connection) {
        connection.cancelPongTimer();
        MessageChannel channel = connection.channel();
        if (channel != null) {
            try {
                channel.onClose();
            } catch (RuntimeException e) {
                log.error("ws:close conn={} channel teardown failed: {}", connection.getId(), e.getMessage(), e);
            }
        }
    }
}
