package com.piacp.gateway.transport;

import java.io.IOException;

/**
 * The server end of one accepted WebSocket, reduced to what connection
 * policy needs.
 */
public interface TransportSocket {

    String id();

    String remoteAddress();

    void send(String text) throws IOException;

    /** Send a protocol-level ping frame. */
    void sendPing() throws IOException;

    /** Close with a WebSocket close code; never throws. */
    void close(int code, String reason);

    boolean isOpen();
}
