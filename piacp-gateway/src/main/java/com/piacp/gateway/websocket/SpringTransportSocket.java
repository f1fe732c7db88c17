package com.piacp.gateway.websocket;

import com.piacp.gateway.transport.TransportSocket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * {@link TransportSocket} over a Spring {@link WebSocketSession}. The session
 * is expected to be a concurrent decorator, since pi events, responses and
 * pings are written from different threads.
 */
@Slf4j
class SpringTransportSocket implements TransportSocket {

    private final WebSocketSession session;

    SpringTransportSocket(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String remoteAddress() {
        Object captured = session.getAttributes().get(WebSocketConfig.REMOTE_ADDR_ATTRIBUTE);
        if (captured != null) {
            return captured.toString();
        }
        InetSocketAddress remote = session.getRemoteAddress();
        return remote != null ? remote.getAddress().getHostAddress() : "unknown";
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void sendPing() throws IOException {
        session.sendMessage(new PingMessage());
    }

    @Override
    public void close(int code, String reason) {
        try {
            if (session.isOpen()) {
                session.close(new CloseStatus(code, reason));
            }
        } catch (IOException | RuntimeException e) {
            log.debug("ws:close conn={} error: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
