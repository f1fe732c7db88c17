package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.piacp.common.error.AcpException;
import com.piacp.gateway.acp.PendingInteractions.Interaction;
import com.piacp.gateway.acp.PendingInteractions.Kind;
import com.piacp.gateway.pi.PiProcess;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A session bound to one pi process for the lifetime of a connection (or
 * until the client opens another one). Relays pi's live events to the client
 * and owns the process handle.
 */
@Slf4j
public class LiveSession implements AutoCloseable {

    private final String sessionId;
    private final String cwd;
    private final PiProcess process;
    private final List<SlashCommand> commands;
    private final AcpClient client;
    private final PendingInteractions interactions;
    private final ToolCallTracker tools = new ToolCallTracker();

    private volatile Runnable unsubscribe;
    private volatile PromptTurn turn;
    private volatile boolean closed;
    // set on cancel until pi reports the end of the aborted run
    private volatile boolean aborting;

    public LiveSession(String sessionId, String cwd, PiProcess process, List<SlashCommand> commands,
            AcpClient client, PendingInteractions interactions) {
        this.sessionId = sessionId;
        this.cwd = cwd;
        this.process = process;
        this.commands = List.copyOf(commands);
        this.client = client;
        this.interactions = interactions;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCwd() {
        return cwd;
    }

    public PiProcess getProcess() {
        return process;
    }

    public List<SlashCommand> getCommands() {
        return commands;
    }

    public ToolCallTracker getTools() {
        return tools;
    }

    public PendingInteractions getInteractions() {
        return interactions;
    }

    /** Start relaying pi events. */
    void attach() {
        this.unsubscribe = process.onEvent(this::onPiEvent);
    }

    void send(ObjectNode update) {
        if (!closed) {
            client.sessionUpdate(sessionId, update);
        }
    }

    // ── Prompt turns ────────────────────────────────────────────

    synchronized PromptTurn beginTurn() {
        if (closed) {
            throw AcpException.sessionExpired(sessionId);
        }
        if (turn != null && !turn.isDone()) {
            throw AcpException.invalidRequest("A prompt is already running for session " + sessionId);
        }
        turn = new PromptTurn();
        return turn;
    }

    public boolean isPrompting() {
        PromptTurn current = turn;
        return current != null && !current.isDone();
    }

    /**
     * Stop the running turn: it resolves as {@code cancelled}, pi is asked to
     * abort, and anything still waiting on the client is withdrawn.
     */
    public void cancel() {
        PromptTurn current = turn;
        if (current == null || !current.finish(PromptTurn.CANCELLED)) {
            return;
        }
        log.info("acp:cancel session={}", sessionId);
        aborting = true;
        withdrawInteractions();
        process.abort().exceptionally(e -> {
            log.warn("pi:abort failed session={}: {}", sessionId, e.getMessage());
            return null;
        });
    }

    // ── pi events ───────────────────────────────────────────────

    void onPiEvent(JsonNode event) {
        if (closed) {
            return;
        }
        String type = event.path("type").asText("");
        if (aborting && dropAfterAbort(type, event)) {
            return;
        }
        switch (type) {
            case "message_update" -> onMessageUpdate(event.path("assistantMessageEvent"));
            case "tool_execution_start" -> {
                synchronized (tools) {
                    send(tools.start(event.path("toolCallId").asText(),
                            event.path("toolName").asText("tool"), event.path("args")));
                }
            }
            case "tool_execution_update" -> {
                synchronized (tools) {
                    send(tools.progress(event.path("toolCallId").asText(), event.path("partialResult")));
                }
            }
            case "tool_execution_end" -> {
                synchronized (tools) {
                    send(tools.finish(event.path("toolCallId").asText(), event.path("result"),
                            event.path("isError").asBoolean(false)));
                }
            }
            case "extension_ui_request" -> onUiRequest(event);
            case "agent_end" -> {
                PromptTurn current = turn;
                if (current != null) {
                    current.finish(PromptTurn.END_TURN);
                }
            }
            case PiProcess.PROCESS_EXIT_EVENT -> onProcessExit(event);
            default -> log.trace("pi:event session={} type={}", sessionId, type);
        }
    }

    /**
     * Output of a cancelled run that pi emits before it stops. Its
     * {@code agent_end} closes the abort window; {@code agent_start} does too,
     * for a run that had already ended when the abort reached pi.
     *
     * @return true if the event belongs to the aborted run
     */
    private boolean dropAfterAbort(String type, JsonNode event) {
        switch (type) {
            case "agent_end" -> {
                aborting = false;
                log.debug("pi:abort settled session={}", sessionId);
                return true;
            }
            case "agent_start" -> {
                aborting = false;
                return false;
            }
            case "message_update", "tool_execution_start", "tool_execution_update", "tool_execution_end" -> {
                return true;
            }
            case "extension_ui_request" -> {
                String requestId = event.path("id").asText(null);
                if (requestId != null) {
                    ObjectNode payload = JsonNodeFactory.instance.objectNode();
                    payload.put("cancelled", true);
                    process.respondToUiRequest(requestId, payload).exceptionally(e -> {
                        log.debug("pi:ui cancel relay failed request={}: {}", requestId, e.getMessage());
                        return null;
                    });
                }
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private void onMessageUpdate(JsonNode assistantEvent) {
        String kind = assistantEvent.path("type").asText("");
        String delta = assistantEvent.path("delta").asText("");
        if (delta.isEmpty()) {
            return;
        }
        if ("text_delta".equals(kind)) {
            send(SessionUpdates.agentMessageChunk(delta));
        } else if ("thinking_delta".equals(kind)) {
            send(SessionUpdates.agentThoughtChunk(delta));
        }
    }

    private void onUiRequest(JsonNode event) {
        String requestId = event.path("id").asText(null);
        String method = event.path("method").asText("");
        Kind kind = switch (method) {
            case "confirm" -> Kind.APPROVAL;
            case "input", "select", "editor" -> Kind.INPUT;
            default -> null;
        };
        if (requestId == null || kind == null) {
            log.debug("pi:ui ignoring request method={} session={}", method, sessionId);
            return;
        }

        String toolCallId;
        synchronized (tools) {
            toolCallId = tools.latestActive().orElse(requestId);
        }
        List<String> options = new ArrayList<>();
        event.path("options").forEach(option -> options.add(option.isTextual()
                ? option.asText()
                : option.path("label").asText(option.toString())));

        Interaction interaction = interactions.register(requestId, toolCallId, kind, method,
                event.path("title").asText(null), event.path("message").asText(null), options,
                this::onInteractionTimeout);
        log.info("acp:interaction open session={} request={} toolCall={} kind={}",
                sessionId, requestId, toolCallId, kind);
        synchronized (tools) {
            send(tools.awaitInput(toolCallId, describe(interaction)));
        }
    }

    private void onInteractionTimeout(Interaction interaction) {
        respondCancelled(interaction);
    }

    /** Relay the client's answer for an interaction back to pi. */
    CompletableFuture<Void> respond(Interaction interaction, ObjectNode payload) {
        synchronized (tools) {
            send(tools.resume(interaction.toolCallId()));
        }
        return process.respondToUiRequest(interaction.requestId(), payload);
    }

    private void respondCancelled(Interaction interaction) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("cancelled", true);
        process.respondToUiRequest(interaction.requestId(), payload).exceptionally(e -> {
            log.debug("pi:ui cancel relay failed request={}: {}", interaction.requestId(), e.getMessage());
            return null;
        });
    }

    private void withdrawInteractions() {
        interactions.drain().forEach(this::respondCancelled);
    }

    private void onProcessExit(JsonNode event) {
        aborting = false;
        log.warn("pi:exit session={} code={}", sessionId, event.path("code").asText("?"));
        PromptTurn current = turn;
        if (current != null) {
            current.fail(AcpException.internal("pi process exited (code " + event.path("code").asText("?") + ")"));
        }
        interactions.drain();
    }

    static ObjectNode describe(Interaction interaction) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("requestId", interaction.requestId());
        node.put("kind", interaction.kind() == Kind.APPROVAL ? "approval" : "input");
        node.put("method", interaction.method());
        if (interaction.title() != null) {
            node.put("title", interaction.title());
        }
        if (interaction.message() != null) {
            node.put("message", interaction.message());
        }
        if (!interaction.options().isEmpty()) {
            interaction.options().forEach(node.putArray("options")::add);
        }
        node.put("expiresAt", interaction.expiresAtMs());
        return node;
    }

    /**
     * Detach from pi and terminate the process. A running turn resolves as
     * {@code cancelled}. Does not wait for the process to exit.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        PromptTurn current = turn;
        if (current != null) {
            current.finish(PromptTurn.CANCELLED);
        }
        interactions.drain();
        Runnable detach = unsubscribe;
        if (detach != null) {
            detach.run();
        }
        synchronized (tools) {
            tools.clear();
        }
        try {
            process.close();
        } catch (RuntimeException e) {
            log.warn("pi:close failed session={}: {}", sessionId, e.getMessage());
        }
        log.info("acp:session closed session={}", sessionId);
    }

    public boolean isClosed() {
        return closed;
    }
}
