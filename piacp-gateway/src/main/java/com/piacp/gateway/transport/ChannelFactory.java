package com.piacp.gateway.transport;

import java.util.function.Consumer;

/**
 * Creates the per-connection consumer of inbound frames.
 */
@FunctionalInterface
public interface ChannelFactory {

    /**
     * @param outbound writes a text frame to the client
     */
    MessageChannel open(String connectionId, Consumer<String> outbound);
}
