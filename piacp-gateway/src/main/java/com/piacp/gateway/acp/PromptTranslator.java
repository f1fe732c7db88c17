package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.JsonNode;
import com.piacp.gateway.pi.PiImage;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts ACP prompt content blocks into pi's prompt shape: one message
 * string plus a separate image list.
 */
public final class PromptTranslator {

    private PromptTranslator() {
    }

    public record PiPrompt(String message, List<PiImage> images) {
    }

    public static PiPrompt translate(JsonNode blocks) {
        StringBuilder message = new StringBuilder();
        List<PiImage> images = new ArrayList<>();
        if (blocks == null || !blocks.isArray()) {
            return new PiPrompt("", images);
        }

        for (JsonNode block : blocks) {
            String type = block.path("type").asText("");
            switch (type) {
                case "text" -> message.append(block.path("text").asText(""));
                case "resource_link" -> message.append("\n[Context] ").append(block.path("uri").asText(""));
                case "image" -> images.add(PiImage.of(
                        block.path("mimeType").asText(null),
                        block.path("data").asText("")));
                case "resource" -> appendResource(message, block.path("resource"));
                case "audio" -> message.append("\n[Audio] (")
                        .append(block.path("mimeType").asText(""))
                        .append(", ")
                        .append(base64ByteLength(block.path("data").asText("")))
                        .append(" bytes) not supported by pi-acp");
                default -> {
                    // unknown block kinds are dropped
                }
            }
        }
        return new PiPrompt(message.toString(), images);
    }

    private static void appendResource(StringBuilder message, JsonNode resource) {
        JsonNode uriNode = resource.path("uri");
        String uri = uriNode.isTextual() ? uriNode.asText() : "(unknown)";
        JsonNode mime = resource.path("mimeType");

        if (resource.path("text").isTextual()) {
            message.append("\n[Embedded Context] ").append(uri)
                    .append(" (").append(mime.isTextual() ? mime.asText() : "text/plain").append(")\n")
                    .append(resource.path("text").asText());
        } else if (resource.path("blob").isTextual()) {
            message.append("\n[Embedded Context] ").append(uri)
                    .append(" (").append(mime.isTextual() ? mime.asText() : "application/octet-stream")
                    .append(", ").append(base64ByteLength(resource.path("blob").asText())).append(" bytes)");
        } else {
            message.append("\n[Embedded Context] ").append(uri);
        }
    }

    /**
     * Decoded size of a base64 payload, computed from its length and padding
     * without decoding it.
     */
    static int base64ByteLength(String base64) {
        int length = base64.length();
        if (length > 0 && base64.charAt(length - 1) == '=') {
            length--;
            if (length > 0 && base64.charAt(length - 1) == '=') {
                length--;
            }
        }
        return (length * 3) >>> 2;
    }
}
