package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.JsonNode;
import com.piacp.common.error.AcpException;

import java.util.Locale;

/**
 * Typed access to request params with Invalid Params errors.
 */
final class Params {

    private Params() {
    }

    static String requireText(JsonNode params, String name) {
        JsonNode value = params == null ? null : params.get(name);
        if (value == null || value.isNull()) {
            throw AcpException.invalidParamsMissing(name);
        }
        if (!value.isTextual()) {
            throw AcpException.invalidParamsTypeMismatch(name, "string", nodeType(value));
        }
        if (value.asText().isBlank()) {
            throw AcpException.invalidParamsFor(name, "must not be empty", value.asText());
        }
        return value.asText();
    }

    static String optionalText(JsonNode params, String name) {
        JsonNode value = params == null ? null : params.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw AcpException.invalidParamsTypeMismatch(name, "string", nodeType(value));
        }
        return value.asText().isBlank() ? null : value.asText();
    }

    static boolean requireBoolean(JsonNode params, String name) {
        JsonNode value = params == null ? null : params.get(name);
        if (value == null || value.isNull()) {
            throw AcpException.invalidParamsMissing(name);
        }
        if (!value.isBoolean()) {
            throw AcpException.invalidParamsTypeMismatch(name, "boolean", nodeType(value));
        }
        return value.booleanValue();
    }

    private static String nodeType(JsonNode value) {
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    /** {@code toolCallId}, falling back to {@code requestId}. */
    static String interactionId(JsonNode params) {
        String id = optionalText(params, "toolCallId");
        if (id == null) {
            id = optionalText(params, "requestId");
        }
        if (id == null) {
            throw AcpException.invalidParamsMissing("toolCallId");
        }
        return id;
    }
}
