package com.piacp.gateway.websocket;

import com.piacp.gateway.transport.ConnectionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Spring WebSocket entry point; forwards every socket event to the
 * {@link ConnectionManager}.
 */
@Slf4j
public class AcpWebSocketHandler extends TextWebSocketHandler {

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 4 * 1024 * 1024;

    private final ConnectionManager connections;

    public AcpWebSocketHandler(ConnectionManager connections) {
        this.connections = connections;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        connections.accept(new SpringTransportSocket(concurrent));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        connections.onMessage(session.getId(), message.getPayload());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        connections.onPong(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.onClose(session.getId(), status.getCode(), status.getReason());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("ws:error conn={}: {}", session.getId(), exception.getMessage());
    }
}
