package com.piacp.gateway.acp;

import java.util.concurrent.CompletableFuture;

/**
 * One forwarded prompt, finished by {@code agent_end}, by cancellation, or
 * by the process going away. The first outcome wins.
 */
final class PromptTurn {

    static final String END_TURN = "end_turn";
    static final String CANCELLED = "cancelled";

    private final CompletableFuture<String> stopReason = new CompletableFuture<>();

    CompletableFuture<String> stopReason() {
        return stopReason;
    }

    boolean finish(String reason) {
        return stopReason.complete(reason);
    }

    boolean fail(Throwable error) {
        return stopReason.completeExceptionally(error);
    }

    boolean isDone() {
        return stopReason.isDone();
    }
}
