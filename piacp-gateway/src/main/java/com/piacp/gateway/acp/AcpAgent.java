package com.piacp.gateway.acp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.piacp.common.error.AcpException;
import com.piacp.gateway.acp.PendingInteractions.Interaction;
import com.piacp.gateway.acp.PendingInteractions.Kind;
import com.piacp.gateway.acp.PendingInteractions.Lookup;
import com.piacp.gateway.acp.PromptTranslator.PiPrompt;
import com.piacp.gateway.pi.PiImage;
import com.piacp.gateway.pi.PiProcess;
import com.piacp.gateway.pi.PiSpawnRequest;
import com.piacp.gateway.pi.PiState;
import com.piacp.gateway.session.SessionListing;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * The ACP agent side of one client connection, backed by pi.
 *
 * <p>
 * Lifecycle: {@code initialize} first, then {@code session/new},
 * {@code session/load} or {@code session/resume} open a {@link LiveSession}
 * (replacing and tearing down any previous one). A connection hosts at most
 * one live session.
 *
 * <p>
 * Calls arrive one at a time from the connection's dispatcher, except that
 * {@code session/cancel} and the interaction answers may arrive while a
 * prompt is running.
 */
@Slf4j
public class AcpAgent implements AutoCloseable {

    public static final int PROTOCOL_VERSION = 1;

    private final AcpClient client;
    private final BridgeContext context;
    private final ObjectMapper mapper;

    private volatile AgentState state = AgentState.UNINITIALIZED;
    private volatile LiveSession session;
    private volatile String lastSessionCwd;

    public AcpAgent(AcpClient client, BridgeContext context) {
        this.client = client;
        this.context = context;
        this.mapper = context.getMapper();
    }

    public AgentState getState() {
        return state;
    }

    public Optional<LiveSession> currentSession() {
        return Optional.ofNullable(session);
    }

    String getLastSessionCwd() {
        return lastSessionCwd;
    }

    void setLastSessionCwd(String cwd) {
        this.lastSessionCwd = cwd;
    }

    // ── initialize ──────────────────────────────────────────────

    public CompletableFuture<Object> initialize(JsonNode params) {
        synchronized (this) {
            if (state == AgentState.CLOSED) {
                throw AcpException.serverError("Connection closed");
            }
            if (state != AgentState.UNINITIALIZED) {
                throw AcpException.alreadyInitialized();
            }
            state = AgentState.INITIALIZED;
        }
        log.info("acp:initialize client={} protocol={}",
                params.path("clientInfo").path("name").asText("?"), params.path("protocolVersion").asText("?"));

        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", PROTOCOL_VERSION);
        ObjectNode capabilities = result.putObject("agentCapabilities");
        capabilities.put("loadSession", true);
        ObjectNode prompt = capabilities.putObject("promptCapabilities");
        prompt.put("image", true);
        prompt.put("audio", false);
        prompt.put("embeddedContext", true);
        ObjectNode sessionCapabilities = capabilities.putObject("sessionCapabilities");
        sessionCapabilities.putObject("list");
        sessionCapabilities.putObject("resume");
        result.putArray("authMethods");
        ObjectNode agentInfo = result.putObject("agentInfo");
        agentInfo.put("name", context.getAgentName());
        agentInfo.put("title", "pi");
        agentInfo.put("version", context.getAgentVersion());
        return CompletableFuture.completedFuture(result);
    }

    // ── session/new ─────────────────────────────────────────────

    public CompletableFuture<Object> newSession(JsonNode params) {
        requireReady();
        String cwd = Params.requireText(params, "cwd");
        PiProcess process = context.getLauncher().spawn(PiSpawnRequest.newSession(cwd));

        return process.getState()
                .thenApply(piState -> piState != null ? piState : new PiState())
                .thenCompose(piState -> models(process, piState).thenApply(models -> {
                    String sessionId = piState.getSessionId() != null
                            ? piState.getSessionId()
                            : UUID.randomUUID().toString();
                    LiveSession live = open(sessionId, cwd, process);
                    String startupInfo = startupInfo(live, piState);

                    client.afterResponse(() -> live.send(SessionUpdates.agentMessageChunk(startupInfo)));
                    scheduleCommandsUpdate(live);

                    ObjectNode result = mapper.createObjectNode();
                    result.put("sessionId", sessionId);
                    result.set("models", models);
                    result.putObject("_meta").putObject("piAcp").put("startupInfo", startupInfo);
                    return (Object) result;
                }))
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.warn("acp:session/new failed cwd={}: {}", cwd, error.getMessage());
                        process.close();
                    }
                });
    }

    // ── session/load, session/resume ────────────────────────────

    public CompletableFuture<Object> loadSession(JsonNode params) {
        return attach(params, "load");
    }

    public CompletableFuture<Object> resumeSession(JsonNode params) {
        return attach(params, "resume");
    }

    private CompletableFuture<Object> attach(JsonNode params, String verb) {
        requireReady();
        String sessionId = Params.requireText(params, "sessionId");
        SessionListing listing = context.getSessions().find(sessionId)
                .orElseThrow(() -> AcpException.sessionNotFound(sessionId));
        String cwd = listing.cwd() != null ? listing.cwd() : Params.optionalText(params, "cwd");
        PiProcess process = context.getLauncher().spawn(PiSpawnRequest.attach(cwd, listing.sessionFile()));
        log.info("acp:session/{} session={} file={}", verb, sessionId, listing.sessionFile());

        return process.getMessages()
                .thenCompose(messages -> process.getState()
                        .exceptionally(e -> {
                            log.debug("pi:get_state failed session={}: {}", sessionId, e.getMessage());
                            return null;
                        })
                        .thenCompose(piState -> models(process, piState))
                        .thenApply(models -> {
                            LiveSession live = open(sessionId, cwd, process);
                            int replayed = new SessionReplayer(live.getTools()).replay(messages, live::send);
                            log.debug("acp:replay session={} messages={} updates={}",
                                    sessionId, messages.size(), replayed);
                            scheduleCommandsUpdate(live);

                            ObjectNode result = mapper.createObjectNode();
                            result.set("models", models);
                            result.putObject("_meta").putObject("piAcp").putNull("startupInfo");
                            return (Object) result;
                        }))
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.warn("acp:session/{} failed session={}: {}", verb, sessionId, error.getMessage());
                        process.close();
                    }
                });
    }

    // ── session/list ────────────────────────────────────────────

    public CompletableFuture<Object> listSessions(JsonNode params) {
        requireReady();
        String cwd = Params.optionalText(params, "cwd");
        if (cwd == null) {
            cwd = lastSessionCwd;
        }
        int offset = parseCursor(Params.optionalText(params, "cursor"));
        List<SessionListing> listings = cwd != null
                ? context.getSessions().list(cwd)
                : context.getSessions().list();

        int pageSize = Math.max(1, context.getSessionPageSize());
        int end = Math.min(listings.size(), offset + pageSize);
        ObjectNode result = mapper.createObjectNode();
        ArrayNode sessions = result.putArray("sessions");
        for (SessionListing listing : listings.subList(Math.min(offset, end), end)) {
            ObjectNode entry = sessions.addObject();
            entry.put("sessionId", listing.sessionId());
            entry.put("cwd", listing.cwd());
            if (listing.title() != null) {
                entry.put("title", listing.title());
            }
            if (listing.updatedAt() != null) {
                entry.put("updatedAt", listing.updatedAt());
            }
            entry.putObject("_meta").putObject("piAcp")
                    .put("sessionFile", listing.sessionFile().toString());
        }
        if (end < listings.size()) {
            result.put("nextCursor", String.valueOf(end));
        }
        return CompletableFuture.completedFuture(result);
    }

    private static int parseCursor(String cursor) {
        if (cursor == null) {
            return 0;
        }
        try {
            int offset = Integer.parseInt(cursor);
            if (offset < 0) {
                throw AcpException.invalidParamsFor("cursor", "must not be negative", cursor);
            }
            return offset;
        } catch (NumberFormatException e) {
            throw AcpException.invalidParamsFor("cursor", "unrecognized cursor", cursor);
        }
    }

    // ── session/prompt, session/cancel ──────────────────────────

    public CompletableFuture<Object> prompt(JsonNode params) {
        LiveSession live = requireSession(Params.requireText(params, "sessionId"));
        JsonNode blocks = params.get("prompt");
        if (blocks == null || !blocks.isArray()) {
            throw AcpException.invalidParamsTypeMismatch("prompt", "array",
                    blocks == null ? null : blocks.getNodeType().toString());
        }

        PiPrompt translated = PromptTranslator.translate(blocks);
        Optional<ParsedCommand> command = ParsedCommand.parse(leadingText(blocks));
        if (command.isPresent()) {
            Optional<CompletableFuture<Void>> builtin;
            PromptTurn turn = beginTurn(live);
            try {
                builtin = BuiltinCommands.handle(command.get(), live);
            } catch (RuntimeException e) {
                turn.fail(e);
                endTurn(live);
                throw e;
            }
            if (builtin.isPresent()) {
                log.info("acp:command session={} command=/{}", live.getSessionId(), command.get().name());
                builtin.get().whenComplete((v, error) -> {
                    if (error != null) {
                        turn.fail(error);
                    } else {
                        turn.finish(PromptTurn.END_TURN);
                    }
                });
                return awaitTurn(live, turn);
            }
            String message = FileCommands.expand(translated.message(), live.getCommands())
                    .orElse(translated.message());
            return forward(live, turn, message, translated.images());
        }
        return forward(live, beginTurn(live), translated.message(), translated.images());
    }

    public void cancel(JsonNode params) {
        String sessionId = params.path("sessionId").asText(null);
        LiveSession live = session;
        if (live == null || !live.getSessionId().equals(sessionId)) {
            log.debug("acp:cancel ignored, no live session {}", sessionId);
            return;
        }
        live.cancel();
    }

    private CompletableFuture<Object> forward(LiveSession live, PromptTurn turn, String message,
            List<PiImage> images) {
        log.info("acp:prompt session={} chars={} images={}", live.getSessionId(), message.length(), images.size());
        live.getProcess().prompt(message, images).whenComplete((v, error) -> {
            if (error != null) {
                turn.fail(error);
            }
        });
        return awaitTurn(live, turn);
    }

    private PromptTurn beginTurn(LiveSession live) {
        PromptTurn turn = live.beginTurn();
        state = AgentState.PROMPTING;
        return turn;
    }

    private CompletableFuture<Object> awaitTurn(LiveSession live, PromptTurn turn) {
        return turn.stopReason()
                .whenComplete((reason, error) -> endTurn(live))
                .thenApply(reason -> {
                    log.debug("acp:prompt done session={} stopReason={}", live.getSessionId(), reason);
                    ObjectNode result = mapper.createObjectNode();
                    result.put("stopReason", reason);
                    return result;
                });
    }

    private void endTurn(LiveSession live) {
        synchronized (this) {
            if (session == live && state == AgentState.PROMPTING) {
                state = AgentState.SESSION_ACTIVE;
            }
        }
    }

    private static String leadingText(JsonNode blocks) {
        if (blocks.size() == 0) {
            return null;
        }
        JsonNode first = blocks.get(0);
        return "text".equals(first.path("type").asText()) ? first.path("text").asText() : null;
    }

    // ── item/tool/requestApproval, item/tool/requestUserInput ──

    public CompletableFuture<Object> requestApproval(JsonNode params) {
        LiveSession live = requireSession(Params.requireText(params, "sessionId"));
        String id = Params.interactionId(params);
        boolean approved = Params.requireBoolean(params, "approved");
        Interaction interaction = takeInteraction(live, id, Kind.APPROVAL);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("confirmed", approved);
        log.info("acp:approval session={} toolCall={} approved={}", live.getSessionId(), id, approved);
        return live.respond(interaction, payload).thenApply(v -> {
            if (!approved) {
                throw AcpException.approvalDenied(interaction.toolCallId());
            }
            ObjectNode result = mapper.createObjectNode();
            result.put("outcome", "approved");
            return result;
        });
    }

    public CompletableFuture<Object> requestUserInput(JsonNode params) {
        LiveSession live = requireSession(Params.requireText(params, "sessionId"));
        String id = Params.interactionId(params);
        JsonNode value = params.get("value");
        if (value == null || value.isNull()) {
            throw AcpException.invalidParamsMissing("value");
        }
        Interaction interaction = takeInteraction(live, id, Kind.INPUT);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("value", value.isTextual() ? value.asText() : value.toString());
        log.info("acp:input session={} toolCall={}", live.getSessionId(), id);
        return live.respond(interaction, payload).thenApply(v -> {
            ObjectNode result = mapper.createObjectNode();
            result.put("outcome", "submitted");
            return result;
        });
    }

    private Interaction takeInteraction(LiveSession live, String id, Kind expected) {
        PendingInteractions interactions = live.getInteractions();
        Optional<Interaction> waiting = interactions.peek(id);
        if (waiting.isPresent() && waiting.get().kind() != expected) {
            throw AcpException.invalidParamsFor("toolCallId",
                    "pending request expects " + (waiting.get().kind() == Kind.APPROVAL ? "an approval" : "user input"),
                    id);
        }
        Lookup lookup = interactions.take(id);
        return switch (lookup.outcome()) {
            case FOUND -> lookup.interaction();
            case EXPIRED -> throw AcpException.userInputTimeout(id, interactions.getTimeoutMs());
            case UNKNOWN -> throw AcpException.toolNotFound(id);
        };
    }

    // ── genui/action ────────────────────────────────────────────

    public CompletableFuture<Object> genuiAction(JsonNode params) {
        LiveSession live = requireSession(Params.requireText(params, "sessionId"));
        String actionId = Params.requireText(params, "actionId");
        String text = "[GenUI Action] " + actionId + " " + payloadJson(params.get("payload"));

        CompletableFuture<Object> outcome;
        try {
            if (live.isPrompting()) {
                log.info("acp:genui steer session={} action={}", live.getSessionId(), actionId);
                outcome = live.getProcess().steer(text).thenApply(v -> {
                    ObjectNode result = mapper.createObjectNode();
                    result.put("outcome", "steered");
                    return result;
                });
            } else {
                log.info("acp:genui prompt session={} action={}", live.getSessionId(), actionId);
                outcome = forward(live, beginTurn(live), text, List.of()).thenApply(turn -> {
                    ObjectNode result = mapper.createObjectNode();
                    result.put("outcome", "completed");
                    result.set("stopReason", ((JsonNode) turn).get("stopReason"));
                    return result;
                });
            }
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        return outcome.handle((result, error) -> {
            if (error != null) {
                throw AcpException.genUiActionFailed(actionId, AcpException.from(error));
            }
            return result;
        });
    }

    private String payloadJson(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            return "{}";
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw AcpException.invalidParamsFor("payload", "not serializable", null);
        }
    }

    // ── lifecycle ───────────────────────────────────────────────

    private LiveSession open(String sessionId, String cwd, PiProcess process) {
        List<SlashCommand> commands = new ArrayList<>(BuiltinCommands.ALL);
        commands.addAll(FileCommands.load(context.getPromptsDir(), cwd));
        PendingInteractions interactions = new PendingInteractions(
                context.getScheduler(), context.getClock(), context.getUserInputTimeoutMs());
        LiveSession live = new LiveSession(sessionId, cwd, process, commands, client, interactions);

        LiveSession previous;
        synchronized (this) {
            if (state == AgentState.CLOSED) {
                live.close();
                throw AcpException.serverError("Connection closed");
            }
            previous = session;
            session = live;
            state = AgentState.SESSION_ACTIVE;
            lastSessionCwd = cwd;
        }
        if (previous != null) {
            log.info("acp:session replaced old={} new={}", previous.getSessionId(), sessionId);
            previous.close();
        }
        live.attach();
        log.info("acp:session open session={} cwd={} commands={}", sessionId, cwd, commands.size());
        return live;
    }

    private void scheduleCommandsUpdate(LiveSession live) {
        client.afterResponse(() -> live.send(SessionUpdates.availableCommandsUpdate(live.getCommands())));
    }

    private CompletableFuture<JsonNode> models(PiProcess process, PiState piState) {
        return process.getAvailableModels().thenApply(models -> {
            ObjectNode node = mapper.createObjectNode();
            ArrayNode available = mapper.createArrayNode();
            for (JsonNode model : models) {
                String id = model.path("id").asText(null);
                if (id == null) {
                    continue;
                }
                String provider = model.path("provider").asText(null);
                String modelId = provider != null ? provider + "/" + id : id;
                available.addObject()
                        .put("modelId", modelId)
                        .put("name", model.path("name").asText(id));
            }
            String current = piState != null ? piState.modelId() : null;
            if (current == null && available.size() > 0) {
                current = available.get(0).path("modelId").asText();
            }
            node.put("currentModelId", current);
            node.set("availableModels", available);
            return (JsonNode) node;
        }).exceptionally(e -> {
            log.debug("pi:get_available_models failed: {}", e.getMessage());
            return NullNode.getInstance();
        });
    }

    private static String startupInfo(LiveSession live, PiState piState) {
        StringBuilder info = new StringBuilder("pi session ").append(live.getSessionId());
        info.append("\ncwd: ").append(live.getCwd());
        String model = piState.modelId();
        info.append("\nmodel: ").append(model != null ? model : "(default)");
        if (piState.getThinkingLevel() != null) {
            info.append("\nthinking: ").append(piState.getThinkingLevel());
        }
        info.append("\ncommands: ").append(live.getCommands().size());
        return info.toString();
    }

    private void requireReady() {
        AgentState current = state;
        if (current == AgentState.UNINITIALIZED) {
            throw AcpException.notInitialized();
        }
        if (current == AgentState.CLOSED) {
            throw AcpException.serverError("Connection closed");
        }
    }

    private LiveSession requireSession(String sessionId) {
        requireReady();
        LiveSession live = session;
        if (live == null || !live.getSessionId().equals(sessionId)) {
            throw AcpException.sessionNotFound(sessionId);
        }
        if (live.isClosed()) {
            throw AcpException.sessionExpired(sessionId);
        }
        return live;
    }

    /**
     * Tear down the live session, if any. Called when the connection goes
     * away; does not wait for pi to exit.
     */
    @Override
    public void close() {
        LiveSession live;
        synchronized (this) {
            if (state == AgentState.CLOSED) {
                return;
            }
            state = AgentState.CLOSED;
            live = session;
            session = null;
        }
        if (live != null) {
            live.close();
        }
    }
}
