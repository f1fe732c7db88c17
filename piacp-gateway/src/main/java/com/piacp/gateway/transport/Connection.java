package com.piacp.gateway.transport;

import java.util.concurrent.ScheduledFuture;

/**
 * Policy state of one admitted socket. Mutated only by
 * {@link ConnectionManager}, under the connection's monitor.
 */
public final class Connection {

    private final String id;
    private final TransportSocket socket;
    private final long connectedAtMs;

    private volatile long lastActivityMs;
    private int windowCount;
    private long windowStartMs;
    private volatile boolean alive = true;
    private ScheduledFuture<?> pongTimer;
    private volatile MessageChannel channel;

    Connection(String id, TransportSocket socket, long nowMs) {
        this.id = id;
        this.socket = socket;
        this.connectedAtMs = nowMs;
        this.lastActivityMs = nowMs;
        this.windowStartMs = nowMs;
    }

    public String getId() {
        return id;
    }

    public long getConnectedAtMs() {
        return connectedAtMs;
    }

    public long getLastActivityMs() {
        return lastActivityMs;
    }

    public boolean isAlive() {
        return alive;
    }

    TransportSocket socket() {
        return socket;
    }

    MessageChannel channel() {
        return channel;
    }

    void bind(MessageChannel channel) {
        this.channel = channel;
    }

    void touch(long nowMs) {
        lastActivityMs = nowMs;
    }

    /**
     * Count one inbound message. A window that has fully elapsed restarts at
     * this message.
     *
     * @return true when the message exceeds the limit
     */
    synchronized boolean countMessage(long nowMs, int limit, long windowMs) {
        if (nowMs - windowStartMs > windowMs) {
            windowStartMs = nowMs;
            windowCount = 1;
            return false;
        }
        windowCount++;
        return windowCount > limit;
    }

    synchronized void probeSent(ScheduledFuture<?> timer) {
        alive = false;
        pongTimer = timer;
    }

    synchronized void markAlive() {
        alive = true;
        cancelPongTimer();
    }

    synchronized void cancelPongTimer() {
        if (pongTimer != null) {
            pongTimer.cancel(false);
            pongTimer = null;
        }
    }
}
