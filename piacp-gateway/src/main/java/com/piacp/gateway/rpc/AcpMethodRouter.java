package com.piacp.gateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.piacp.common.error.AcpException;
import com.piacp.gateway.acp.AcpAgent;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes ACP method calls to handlers. One router is shared by all
 * connections; each call is handed the connection's {@link AcpAgent}.
 */
@Slf4j
public class AcpMethodRouter {

    @FunctionalInterface
    public interface MethodHandler {
        CompletableFuture<Object> handle(JsonNode params, AcpAgent agent);
    }

    @FunctionalInterface
    public interface NotificationHandler {
        void handle(JsonNode params, AcpAgent agent);
    }

    /**
     * @param detached the connection may handle later messages before this
     *                 call's response is ready
     */
    private record Route(MethodHandler handler, boolean detached) {
    }

    private final Map<String, Route> methodHandlers = new ConcurrentHashMap<>();
    private final Map<String, NotificationHandler> notificationHandlers = new ConcurrentHashMap<>();

    /**
     * Register a request handler. The connection handles nothing else until
     * the returned future completes.
     */
    public void registerMethod(String method, MethodHandler handler) {
        methodHandlers.put(method, new Route(handler, false));
        log.debug("Registered method handler: {}", method);
    }

    /**
     * Register a long-running request handler. Later messages on the
     * connection are handled as soon as the handler returns; the response is
     * sent when its future completes.
     */
    public void registerDetachedMethod(String method, MethodHandler handler) {
        methodHandlers.put(method, new Route(handler, true));
        log.debug("Registered detached method handler: {}", method);
    }

    public void registerNotification(String method, NotificationHandler handler) {
        notificationHandlers.put(method, handler);
        log.debug("Registered notification handler: {}", method);
    }

    public CompletableFuture<Object> dispatch(String method, JsonNode params, AcpAgent agent) {
        Route route = methodHandlers.get(method);
        if (route == null) {
            NotificationHandler notification = notificationHandlers.get(method);
            if (notification != null) {
                // a notification sent as a request still gets an (empty) answer
                handleNotification(method, params, agent);
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.failedFuture(AcpException.methodNotFound(method));
        }

        try {
            return route.handler().handle(params, agent);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public boolean isDetached(String method) {
        Route route = methodHandlers.get(method);
        return route != null && route.detached();
    }

    public void handleNotification(String method, JsonNode params, AcpAgent agent) {
        NotificationHandler handler = notificationHandlers.get(method);
        if (handler != null) {
            try {
                handler.handle(params, agent);
            } catch (Exception e) {
                log.error("Notification handler failed for {}: {}", method, e.getMessage(), e);
            }
        } else {
            log.debug("No handler for notification: {}", method);
        }
    }

    public Set<String> getRegisteredMethods() {
        return Collections.unmodifiableSet(methodHandlers.keySet());
    }
}
