package com.piacp.gateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.piacp.common.error.AcpException;
import com.piacp.common.model.JsonRpcMessage;

/**
 * Validates inbound JSON-RPC envelopes.
 */
public final class JsonRpcCodec {

    private JsonRpcCodec() {
    }

    /**
     * @return the request or notification, or null for a response to a
     *         server-initiated request (which this server never issues)
     * @throws AcpException InvalidRequest for anything else
     */
    public static JsonRpcMessage.Request decode(JsonNode frame) {
        if (frame == null || !frame.isObject()) {
            throw AcpException.invalidRequest("Expected a JSON-RPC object (batches are not supported)");
        }
        if (!JsonRpcMessage.VERSION.equals(frame.path("jsonrpc").asText(null))) {
            throw AcpException.invalidRequest("jsonrpc must be \"2.0\"");
        }
        JsonNode id = frame.get("id");
        if (id != null && !(id.isTextual() || id.isIntegralNumber() || id.isNull())) {
            throw AcpException.invalidRequest("id must be a string, an integer or null");
        }

        JsonNode method = frame.get("method");
        if (method == null) {
            if (id != null && (frame.has("result") || frame.has("error"))) {
                return null;
            }
            throw AcpException.invalidRequest("Missing method");
        }
        if (!method.isTextual() || method.asText().isEmpty()) {
            throw AcpException.invalidRequest("method must be a non-empty string");
        }

        JsonNode params = frame.get("params");
        if (params == null || params.isNull()) {
            params = JsonNodeFactory.instance.objectNode();
        } else if (!params.isContainerNode()) {
            throw AcpException.invalidRequest("params must be an object or an array");
        }
        return JsonRpcMessage.Request.create(id, method.asText(), params);
    }

    /** Best-effort id of a frame that failed validation, for the error response. */
    public static JsonNode idOf(JsonNode frame) {
        JsonNode id = frame != null && frame.isObject() ? frame.get("id") : null;
        if (id != null && (id.isTextual() || id.isIntegralNumber())) {
            return id;
        }
        return null;
    }
}
