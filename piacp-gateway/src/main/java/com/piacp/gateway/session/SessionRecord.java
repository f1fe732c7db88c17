package com.piacp.gateway.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * One line of a pi session log, discriminated on its {@code type} field.
 *
 * <p>
 * Parsing never throws: blank or malformed lines and record kinds the bridge
 * does not interpret come back as {@link Other}.
 */
public interface SessionRecord {

    DateTimeFormatter ISO_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    /** Normalized ISO timestamp of the record, if it carried a parsable one. */
    Optional<String> timestamp();

    /** {@code {type:"session", id, cwd, timestamp, version}}; id and cwd are required. */
    record Header(String id, String cwd, Optional<String> timestamp, Integer version) implements SessionRecord {
    }

    /** {@code {type:"message", id, parentId, timestamp, message:{role, content}}}. */
    record Message(String id, String parentId, Optional<String> timestamp, String role, JsonNode content)
            implements SessionRecord {

        /**
         * Text of the message: a string content as-is, otherwise the first
         * {@code text} block of a content array.
         */
        public Optional<String> firstText() {
            if (content == null) {
                return Optional.empty();
            }
            if (content.isTextual()) {
                return Optional.of(content.asText());
            }
            if (content.isArray()) {
                for (JsonNode block : content) {
                    if ("text".equals(block.path("type").asText(null)) && block.path("text").isTextual()) {
                        return Optional.of(block.get("text").asText());
                    }
                }
            }
            return Optional.empty();
        }
    }

    /** {@code {type:"session_info", id, parentId, timestamp, name}}: a rename. */
    record SessionInfo(String id, String parentId, Optional<String> timestamp, String name)
            implements SessionRecord {

        /** Trimmed name, absent when blank. */
        public Optional<String> displayName() {
            if (name == null || name.trim().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(name.trim());
        }
    }

    /** Any other record kind, or a line that did not parse (type is then null). */
    record Other(String type, Optional<String> timestamp) implements SessionRecord {
    }

    Other UNPARSABLE = new Other(null, Optional.empty());

    /**
     * Parse a single log line.
     */
    static SessionRecord parse(ObjectMapper mapper, String line) {
        if (line == null) {
            return UNPARSABLE;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return UNPARSABLE;
        }
        JsonNode node;
        try {
            node = mapper.readTree(trimmed);
        } catch (Exception e) {
            return UNPARSABLE;
        }
        if (node == null || !node.isObject()) {
            return UNPARSABLE;
        }

        String type = node.path("type").isTextual() ? node.get("type").asText() : null;
        Optional<String> timestamp = normalizeTimestamp(node.path("timestamp").isTextual()
                ? node.get("timestamp").asText()
                : null);

        if ("session".equals(type)) {
            String id = textOrNull(node, "id");
            String cwd = textOrNull(node, "cwd");
            if (id == null || id.isEmpty() || cwd == null || cwd.isEmpty()) {
                return new Other(type, timestamp);
            }
            Integer version = node.path("version").isInt() ? node.get("version").asInt() : null;
            return new Header(id, cwd, timestamp, version);
        }
        if ("message".equals(type)) {
            JsonNode message = node.path("message");
            return new Message(textOrNull(node, "id"), textOrNull(node, "parentId"), timestamp,
                    textOrNull(message, "role"), message.get("content"));
        }
        if ("session_info".equals(type)) {
            return new SessionInfo(textOrNull(node, "id"), textOrNull(node, "parentId"), timestamp,
                    textOrNull(node, "name"));
        }
        return new Other(type, timestamp);
    }

    /**
     * Normalize an ISO-8601 timestamp to UTC with millisecond precision
     * ({@code 2026-01-01T00:00:02.000Z}); unparsable values are absent.
     */
    static Optional<String> normalizeTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ISO_MILLIS.format(Instant.parse(raw.trim())));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(ISO_MILLIS.format(OffsetDateTime.parse(raw.trim()).toInstant()));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    static String formatInstant(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }
}
