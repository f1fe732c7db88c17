package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Builders for the {@code update} member of {@code session/update}
 * notifications.
 */
public final class SessionUpdates {

    public static final String USER_MESSAGE_CHUNK = "user_message_chunk";
    public static final String AGENT_MESSAGE_CHUNK = "agent_message_chunk";
    public static final String AGENT_THOUGHT_CHUNK = "agent_thought_chunk";
    public static final String TOOL_CALL = "tool_call";
    public static final String TOOL_CALL_UPDATE = "tool_call_update";
    public static final String AVAILABLE_COMMANDS_UPDATE = "available_commands_update";
    public static final String SESSION_INFO_UPDATE = "session_info_update";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SessionUpdates() {
    }

    public static ObjectNode userMessageChunk(String text) {
        return chunk(USER_MESSAGE_CHUNK, textContent(text));
    }

    public static ObjectNode agentMessageChunk(String text) {
        return chunk(AGENT_MESSAGE_CHUNK, textContent(text));
    }

    public static ObjectNode agentThoughtChunk(String text) {
        return chunk(AGENT_THOUGHT_CHUNK, textContent(text));
    }

    public static ObjectNode chunk(String kind, JsonNode content) {
        ObjectNode update = NODES.objectNode();
        update.put("sessionUpdate", kind);
        update.set("content", content);
        return update;
    }

    public static ObjectNode toolCall(String toolCallId, String title, String kind, ToolCallStatus status,
            JsonNode rawInput) {
        ObjectNode update = NODES.objectNode();
        update.put("sessionUpdate", TOOL_CALL);
        update.put("toolCallId", toolCallId);
        update.put("title", title);
        update.put("kind", kind);
        update.put("status", status.wireName());
        if (rawInput != null && !rawInput.isMissingNode() && !rawInput.isNull()) {
            update.set("rawInput", rawInput);
        }
        return update;
    }

    public static ObjectNode toolCallUpdate(String toolCallId, ToolCallStatus status, List<JsonNode> content) {
        ObjectNode update = NODES.objectNode();
        update.put("sessionUpdate", TOOL_CALL_UPDATE);
        update.put("toolCallId", toolCallId);
        update.put("status", status.wireName());
        if (content != null && !content.isEmpty()) {
            ArrayNode array = update.putArray("content");
            content.forEach(array::add);
        }
        return update;
    }

    public static ObjectNode sessionInfoUpdate(String title) {
        ObjectNode update = NODES.objectNode();
        update.put("sessionUpdate", SESSION_INFO_UPDATE);
        update.put("title", title);
        return update;
    }

    public static ObjectNode availableCommandsUpdate(List<SlashCommand> commands) {
        ObjectNode update = NODES.objectNode();
        update.put("sessionUpdate", AVAILABLE_COMMANDS_UPDATE);
        ArrayNode array = update.putArray("availableCommands");
        for (SlashCommand command : commands) {
            ObjectNode entry = array.addObject();
            entry.put("name", command.name());
            entry.put("description", command.description());
            if (command.inputHint() != null) {
                entry.putObject("input").put("hint", command.inputHint());
            }
        }
        return update;
    }

    public static ObjectNode textContent(String text) {
        ObjectNode content = NODES.objectNode();
        content.put("type", "text");
        content.put("text", text);
        return content;
    }

    /** Wraps a content block as tool-call content ({@code {type:"content", content}}). */
    public static ObjectNode toolContent(JsonNode block) {
        ObjectNode wrapper = NODES.objectNode();
        wrapper.put("type", "content");
        wrapper.set("content", block);
        return wrapper;
    }
}
