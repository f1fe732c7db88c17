package com.piacp.gateway.rpc;

import com.piacp.gateway.acp.BridgeContext;
import com.piacp.gateway.transport.ChannelFactory;
import com.piacp.gateway.transport.MessageChannel;

import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Gives every admitted connection its own ACP endpoint and agent.
 */
public class AcpChannelFactory implements ChannelFactory {

    private final AcpMethodRouter router;
    private final BridgeContext context;
    private final Executor executor;

    public AcpChannelFactory(AcpMethodRouter router, BridgeContext context, Executor executor) {
        this.router = router;
        this.context = context;
        this.executor = executor;
    }

    @Override
    public MessageChannel open(String connectionId, Consumer<String> outbound) {
        return new AcpRpcEndpoint(connectionId, router, context, outbound, executor);
    }
}
