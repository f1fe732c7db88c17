package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reconstructs tool call state from pi's flat event and message streams and
 * renders it as {@code tool_call} / {@code tool_call_update} notifications.
 *
 * <p>
 * Not thread-safe; owned by one live session and driven from pi's event
 * thread or from a replay.
 */
public class ToolCallTracker {

    public static final class ToolCall {
        private final String id;
        private final String title;
        private final String kind;
        private ToolCallStatus status;
        private final List<JsonNode> content = new ArrayList<>();

        ToolCall(String id, String title, String kind) {
            this.id = id;
            this.title = title;
            this.kind = kind;
            this.status = ToolCallStatus.IN_PROGRESS;
        }

        public String id() {
            return id;
        }

        public String title() {
            return title;
        }

        public String kind() {
            return kind;
        }

        public ToolCallStatus status() {
            return status;
        }

        public List<JsonNode> content() {
            return List.copyOf(content);
        }
    }

    private final Map<String, ToolCall> calls = new LinkedHashMap<>();

    /** {@code tool_execution_start}: the call becomes in_progress. */
    public ObjectNode start(String toolCallId, String toolName, JsonNode args) {
        ToolCall call = new ToolCall(toolCallId, toolName, kindFor(toolName));
        calls.put(toolCallId, call);
        return SessionUpdates.toolCall(toolCallId, call.title, call.kind, call.status, args);
    }

    /** {@code tool_execution_update}: partial output replaces the content so far. */
    public ObjectNode progress(String toolCallId, JsonNode partialResult) {
        ToolCall call = calls.computeIfAbsent(toolCallId, id -> new ToolCall(id, id, "other"));
        call.status = ToolCallStatus.IN_PROGRESS;
        call.content.clear();
        call.content.addAll(toContent(partialResult));
        return SessionUpdates.toolCallUpdate(toolCallId, call.status, call.content);
    }

    /** {@code tool_execution_end}: terminal status with the final result attached. */
    public ObjectNode finish(String toolCallId, JsonNode result, boolean isError) {
        ToolCall call = calls.computeIfAbsent(toolCallId, id -> new ToolCall(id, id, "other"));
        call.status = isError ? ToolCallStatus.FAILED : ToolCallStatus.COMPLETED;
        call.content.clear();
        call.content.addAll(toContent(result));
        ObjectNode update = SessionUpdates.toolCallUpdate(toolCallId, call.status, call.content);
        if (result != null && !result.isMissingNode() && !result.isNull()) {
            update.set("rawOutput", result);
        }
        return update;
    }

    /** Waiting on the client; carries the interaction under {@code _meta.piAcp}. */
    public ObjectNode awaitInput(String toolCallId, JsonNode interaction) {
        ToolCall call = calls.get(toolCallId);
        if (call != null) {
            call.status = ToolCallStatus.PENDING;
        }
        ObjectNode update = SessionUpdates.toolCallUpdate(toolCallId, ToolCallStatus.PENDING, List.of());
        update.putObject("_meta").putObject("piAcp").set("interaction", interaction);
        return update;
    }

    /** The client answered; the call resumes. */
    public ObjectNode resume(String toolCallId) {
        ToolCall call = calls.get(toolCallId);
        if (call != null && call.status == ToolCallStatus.PENDING) {
            call.status = ToolCallStatus.IN_PROGRESS;
        }
        return SessionUpdates.toolCallUpdate(toolCallId, ToolCallStatus.IN_PROGRESS, List.of());
    }

    /**
     * History replay: a {@code toolResult} message carries no matching start
     * record, so the call is synthesized from the result alone.
     */
    public List<ObjectNode> replayResult(String toolCallId, String toolName, JsonNode content, boolean isError) {
        ObjectNode started = start(toolCallId, toolName, null);
        ToolCall call = calls.get(toolCallId);
        call.status = isError ? ToolCallStatus.FAILED : ToolCallStatus.COMPLETED;
        call.content.addAll(toContent(content));
        return List.of(started, SessionUpdates.toolCallUpdate(toolCallId, call.status, call.content));
    }

    /** Most recently started call that has not finished. */
    public Optional<String> latestActive() {
        String latest = null;
        for (ToolCall call : calls.values()) {
            if (!call.status.isTerminal()) {
                latest = call.id;
            }
        }
        return Optional.ofNullable(latest);
    }

    public Optional<ToolCall> get(String toolCallId) {
        return Optional.ofNullable(calls.get(toolCallId));
    }

    public void clear() {
        calls.clear();
    }

    /**
     * pi's tool names to ACP tool kinds.
     */
    public static String kindFor(String toolName) {
        if (toolName == null) {
            return "other";
        }
        return switch (toolName.toLowerCase(Locale.ROOT)) {
            case "bash" -> "execute";
            case "read" -> "read";
            case "edit", "write" -> "edit";
            case "grep", "find", "ls" -> "search";
            default -> "other";
        };
    }

    /**
     * Tool output ({@code {content:[...]}}, a bare block array or a string)
     * as tool-call content entries.
     */
    static List<JsonNode> toContent(JsonNode result) {
        List<JsonNode> out = new ArrayList<>();
        if (result == null || result.isMissingNode() || result.isNull()) {
            return out;
        }
        JsonNode blocks = result.isObject() && result.has("content") ? result.get("content") : result;
        if (blocks.isTextual()) {
            out.add(SessionUpdates.toolContent(SessionUpdates.textContent(blocks.asText())));
            return out;
        }
        if (!blocks.isArray()) {
            return out;
        }
        for (JsonNode block : blocks) {
            String type = block.path("type").asText("");
            if ("text".equals(type)) {
                out.add(SessionUpdates.toolContent(SessionUpdates.textContent(block.path("text").asText(""))));
            } else if ("image".equals(type)) {
                out.add(SessionUpdates.toolContent(block));
            }
        }
        return out;
    }
}
