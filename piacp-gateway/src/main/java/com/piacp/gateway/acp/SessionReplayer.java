package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

/**
 * Turns pi's message history into the ordered {@code session/update}
 * sequence a client would have seen live.
 */
@Slf4j
public class SessionReplayer {

    private final ToolCallTracker tools;

    public SessionReplayer(ToolCallTracker tools) {
        this.tools = tools;
    }

    /**
     * Emit updates for every message, in order.
     *
     * @return number of updates emitted
     */
    public int replay(List<JsonNode> messages, Consumer<ObjectNode> sink) {
        int emitted = 0;
        for (JsonNode message : messages) {
            String role = message.path("role").asText("");
            switch (role) {
                case "user" -> emitted += replayUser(message.path("content"), sink);
                case "assistant" -> emitted += replayAssistant(message.path("content"), sink);
                case "toolResult" -> emitted += replayToolResult(message, sink);
                default -> log.debug("acp:replay skipping message role={}", role);
            }
        }
        return emitted;
    }

    private int replayUser(JsonNode content, Consumer<ObjectNode> sink) {
        if (content.isTextual()) {
            sink.accept(SessionUpdates.userMessageChunk(content.asText()));
            return 1;
        }
        int emitted = 0;
        for (JsonNode block : content) {
            String type = block.path("type").asText("");
            if ("text".equals(type)) {
                sink.accept(SessionUpdates.userMessageChunk(block.path("text").asText("")));
                emitted++;
            } else if ("image".equals(type)) {
                sink.accept(SessionUpdates.chunk(SessionUpdates.USER_MESSAGE_CHUNK, block));
                emitted++;
            }
        }
        return emitted;
    }

    private int replayAssistant(JsonNode content, Consumer<ObjectNode> sink) {
        if (content.isTextual()) {
            sink.accept(SessionUpdates.agentMessageChunk(content.asText()));
            return 1;
        }
        int emitted = 0;
        for (JsonNode block : content) {
            String type = block.path("type").asText("");
            if ("text".equals(type)) {
                sink.accept(SessionUpdates.agentMessageChunk(block.path("text").asText("")));
                emitted++;
            } else if ("thinking".equals(type)) {
                sink.accept(SessionUpdates.agentThoughtChunk(block.path("thinking").asText("")));
                emitted++;
            }
            // toolCall blocks are covered by the matching toolResult message
        }
        return emitted;
    }

    private int replayToolResult(JsonNode message, Consumer<ObjectNode> sink) {
        String toolCallId = message.path("toolCallId").asText(null);
        if (toolCallId == null) {
            log.debug("acp:replay toolResult without toolCallId");
            return 0;
        }
        String toolName = message.path("toolName").asText("tool");
        List<ObjectNode> updates = tools.replayResult(toolCallId, toolName,
                message.path("content"), message.path("isError").asBoolean(false));
        updates.forEach(sink);
        return updates.size();
    }
}
