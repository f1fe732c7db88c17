package com.piacp.gateway.websocket;

import com.piacp.gateway.transport.ConnectionManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.util.Map;

/**
 * Registers the ACP WebSocket endpoint. Requests to the endpoint path that
 * are not WebSocket upgrades are answered with 404.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String REMOTE_ADDR_ATTRIBUTE = "ws.remoteAddr";

    private final ConnectionManager connectionManager;
    private final String path;

    public WebSocketConfig(ConnectionManager connectionManager,
            @Value("${piacp.server.ws-path:/}") String path) {
        this.connectionManager = connectionManager;
        this.path = path;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(acpWebSocketHandler(), path)
                .addInterceptors(upgradeOnlyInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public AcpWebSocketHandler acpWebSocketHandler() {
        return new AcpWebSocketHandler(connectionManager);
    }

    /**
     * Rejects anything but a GET upgrade with 404, and captures the remote
     * address for logging.
     */
    @Bean
    public HandshakeInterceptor upgradeOnlyInterceptor() {
        return new HandshakeInterceptor() {
            @Override
            public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @NonNull Map<String, Object> attributes) {
                String upgrade = request.getHeaders().getUpgrade();
                if (!HttpMethod.GET.equals(request.getMethod()) || !"websocket".equalsIgnoreCase(upgrade)) {
                    response.setStatusCode(HttpStatus.NOT_FOUND);
                    return false;
                }
                if (request.getRemoteAddress() != null && request.getRemoteAddress().getAddress() != null) {
                    attributes.put(REMOTE_ADDR_ATTRIBUTE,
                            request.getRemoteAddress().getAddress().getHostAddress());
                }
                return true;
            }

            @Override
            public void afterHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @Nullable Exception exception) {
                // no-op
            }
        };
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(4 * 1024 * 1024);
        container.setMaxBinaryMessageBufferSize(512 * 1024);
        // idle eviction is done by ConnectionManager
        container.setMaxSessionIdleTimeout(0L);
        return container;
    }
}
