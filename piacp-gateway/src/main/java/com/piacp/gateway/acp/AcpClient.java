package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The client end of one ACP connection, as seen by the bridge.
 */
public interface AcpClient {

    /** Send a {@code session/update} notification. */
    void sessionUpdate(String sessionId, ObjectNode update);

    /**
     * Run {@code task} after the response to the request being handled has
     * been written, so that notifications it sends follow that response.
     */
    void afterResponse(Runnable task);
}
