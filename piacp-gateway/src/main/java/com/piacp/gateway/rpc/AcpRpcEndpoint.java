package com.piacp.gateway.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.piacp.common.error.AcpErrorCode;
import com.piacp.common.error.AcpException;
import com.piacp.common.model.JsonRpcMessage;
import com.piacp.gateway.acp.AcpAgent;
import com.piacp.gateway.acp.AcpClient;
import com.piacp.gateway.acp.BridgeContext;
import com.piacp.gateway.transport.MessageChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * JSON-RPC endpoint of one connection: decodes frames, runs them through
 * the router against this connection's {@link AcpAgent}, and writes
 * responses and notifications back.
 *
 * <p>
 * Messages are handled strictly one after another, on the worker executor.
 * A detached method (a prompt turn) releases the queue once its handler has
 * returned, so that {@code session/cancel} can reach the running turn.
 */
@Slf4j
public class AcpRpcEndpoint implements MessageChannel, AcpClient {

    private final String connectionId;
    private final AcpMethodRouter router;
    private final ObjectMapper mapper;
    private final Consumer<String> outbound;
    private final Executor executor;
    private final AcpAgent agent;
    private final Queue<Runnable> afterResponse = new ConcurrentLinkedQueue<>();

    private final Object sequence = new Object();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    public AcpRpcEndpoint(String connectionId, AcpMethodRouter router, BridgeContext context,
            Consumer<String> outbound, Executor executor) {
        this.connectionId = connectionId;
        this.router = router;
        this.mapper = context.getMapper();
        this.outbound = outbound;
        this.executor = executor;
        this.agent = new AcpAgent(this, context);
    }

    public AcpAgent getAgent() {
        return agent;
    }

    // ── Inbound ─────────────────────────────────────────────────

    @Override
    public void onMessage(JsonNode frame) {
        JsonRpcMessage.Request request;
        try {
            request = JsonRpcCodec.decode(frame);
        } catch (AcpException e) {
            log.debug("acp:in conn={} rejected frame: {}", connectionId, e.getMessage());
            writeResponse(JsonRpcMessage.Response.failure(JsonRpcCodec.idOf(frame), e.toRpcError()));
            return;
        }
        if (request == null) {
            log.debug("acp:in conn={} ignoring client response id={}", connectionId, frame.get("id"));
            return;
        }

        synchronized (sequence) {
            tail = tail.thenComposeAsync(ignored -> handle(request), executor)
                    .exceptionally(error -> {
                        log.error("acp:in conn={} dispatch failed: {}", connectionId, error.getMessage(), error);
                        return null;
                    });
        }
    }

    /**
     * @return completes when the next message may be handled
     */
    private CompletableFuture<Void> handle(JsonRpcMessage.Request request) {
        String method = request.getMethod();
        JsonNode params = (JsonNode) request.getParams();
        log.debug("acp:in conn={} id={} method={}", connectionId, request.getId(), method);

        if (request.isNotification()) {
            router.handleNotification(method, params, agent);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> responded = router.dispatch(method, params, agent)
                .handle((result, error) -> {
                    respond(request, result, error);
                    return null;
                });
        return router.isDetached(method) ? CompletableFuture.completedFuture(null) : responded;
    }

    private void respond(JsonRpcMessage.Request request, Object result, Throwable error) {
        if (error == null) {
            log.debug("acp:out conn={} id={} method={} ok=true", connectionId, request.getId(), request.getMethod());
            writeResponse(JsonRpcMessage.Response.success(request.getId(), result));
            return;
        }
        AcpException failure = AcpException.from(error);
        if (failure.is(AcpErrorCode.INTERNAL_ERROR)) {
            log.error("acp:out conn={} method={} failed: {}", connectionId, request.getMethod(),
                    failure.getMessage(), failure);
        } else {
            log.debug("acp:out conn={} id={} method={} error={} {}", connectionId, request.getId(),
                    request.getMethod(), failure.getNumericCode(), failure.getMessage());
        }
        writeResponse(JsonRpcMessage.Response.failure(request.getId(), failure.toRpcError()));
    }

    // ── Outbound ────────────────────────────────────────────────

    @Override
    public void sessionUpdate(String sessionId, ObjectNode update) {
        ObjectNode params = mapper.createObjectNode();
        params.put("sessionId", sessionId);
        params.set("update", update);
        write(JsonRpcMessage.Notification.create(AcpMethods.SESSION_UPDATE, params));
    }

    @Override
    public void afterResponse(Runnable task) {
        afterResponse.add(task);
    }

    private void writeResponse(JsonRpcMessage.Response response) {
        write(response);
        Runnable task;
        while ((task = afterResponse.poll()) != null) {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("acp:out conn={} deferred notification failed: {}", connectionId, e.getMessage(), e);
            }
        }
    }

    private void write(Object message) {
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("acp:out conn={} cannot serialize {}: {}", connectionId,
                    message.getClass().getSimpleName(), e.getMessage(), e);
            return;
        }
        outbound.accept(json);
    }

    // ── Lifecycle ───────────────────────────────────────────────

    @Override
    public void onClose() {
        afterResponse.clear();
        agent.close();
    }
}
