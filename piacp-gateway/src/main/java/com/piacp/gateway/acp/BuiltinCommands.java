package com.piacp.gateway.acp;

import com.piacp.gateway.pi.PiState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Slash commands answered by the bridge itself; pi never sees these prompts.
 */
@Slf4j
final class BuiltinCommands {

    static final List<SlashCommand> ALL = List.of(
            SlashCommand.builtin("steering", "Show the current steering mode", null),
            SlashCommand.builtin("name", "Set the session display name", "session name"));

    private BuiltinCommands() {
    }

    /**
     * @return the command's completion, or empty when {@code command} is not
     *         a built-in
     */
    static Optional<CompletableFuture<Void>> handle(ParsedCommand command, LiveSession session) {
        return switch (command.name()) {
            case "steering" -> Optional.of(steering(session));
            case "name" -> Optional.of(name(session, command.args()));
            default -> Optional.empty();
        };
    }

    private static CompletableFuture<Void> steering(LiveSession session) {
        return session.getProcess().getState().thenAccept(piState -> {
            PiState state = piState != null ? piState : new PiState();
            String mode = state.getSteeringMode() != null ? state.getSteeringMode() : "unknown";
            StringBuilder text = new StringBuilder("Steering mode: ").append(mode);
            if (state.getFollowUpMode() != null) {
                text.append("\nFollow-up mode: ").append(state.getFollowUpMode());
            }
            session.send(SessionUpdates.agentMessageChunk(text.toString()));
        });
    }

    private static CompletableFuture<Void> name(LiveSession session, String name) {
        if (name.isEmpty()) {
            session.send(SessionUpdates.agentMessageChunk("Usage: /name <session name>"));
            return CompletableFuture.completedFuture(null);
        }
        return session.getProcess().setSessionName(name).thenRun(() -> {
            log.info("acp:rename session={} title={}", session.getSessionId(), name);
            session.send(SessionUpdates.sessionInfoUpdate(name));
            session.send(SessionUpdates.agentMessageChunk("Session name set: " + name));
        });
    }
}
