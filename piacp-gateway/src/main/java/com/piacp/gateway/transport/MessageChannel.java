package com.piacp.gateway.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receiving side of an admitted connection. Only well-formed JSON frames
 * that passed rate limiting arrive here.
 */
public interface MessageChannel {

    void onMessage(JsonNode message);

    /** The connection is gone, for whatever reason. Called once. */
    void onClose();
}
