package com.piacp.gateway.pi;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Handle to one running pi agent process.
 *
 * <p>
 * Commands complete when pi acknowledges them. {@link #prompt} completes as
 * soon as the prompt is accepted; the turn itself is observed through
 * {@link #onEvent} until an {@code agent_end} event arrives.
 */
public interface PiProcess extends AutoCloseable {

    /** Synthetic event emitted to listeners when the process goes away. */
    String PROCESS_EXIT_EVENT = "process_exit";

    CompletableFuture<Void> prompt(String message, List<PiImage> images);

    /** Inject a message into the running turn. */
    CompletableFuture<Void> steer(String message);

    /** Stop the running turn. */
    CompletableFuture<Void> abort();

    /** Conversation history as pi's message objects ({@code role}, {@code content}, ...). */
    CompletableFuture<List<JsonNode>> getMessages();

    /** Available models as pi's model objects ({@code provider}, {@code id}, {@code name}). */
    CompletableFuture<List<JsonNode>> getAvailableModels();

    CompletableFuture<PiState> getState();

    /** Rename the session; pi appends a {@code session_info} record to the log. */
    CompletableFuture<Void> setSessionName(String name);

    /**
     * Answer an {@code extension_ui_request} event, e.g. {@code {confirmed:true}},
     * {@code {value:"..."}} or {@code {cancelled:true}}.
     */
    CompletableFuture<Void> respondToUiRequest(String requestId, JsonNode response);

    /**
     * Subscribe to every event pi emits.
     *
     * @return handle that removes the listener
     */
    Runnable onEvent(Consumer<JsonNode> listener);

    /** Terminate the process without waiting for it to exit. */
    @Override
    void close();
}
