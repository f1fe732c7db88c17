package com.piacp.gateway.pi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * pi running in RPC mode as a child process.
 *
 * <p>
 * Wire format (one JSON object per line):
 * <ul>
 * <li>stdin: {@code {id, type:"prompt"|"get_state"|..., ...}}</li>
 * <li>stdout: {@code {type:"response", id, command, success, data?, error?}}
 * for commands, any other object is an event.</li>
 * </ul>
 * stderr is drained into the debug log.
 */
@Slf4j
public class PiRpcProcess implements PiProcess {

    private static final long KILL_GRACE_MS = 2_000;

    private final Process process;
    private final ObjectMapper mapper;
    private final BufferedWriter stdin;
    private final AtomicLong requestCounter = new AtomicLong(0);
    private final Map<String, PendingCommand> pending = new ConcurrentHashMap<>();
    private final List<Consumer<JsonNode>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private record PendingCommand(String command, CompletableFuture<JsonNode> future) {
    }

    PiRpcProcess(Process process, ObjectMapper mapper) {
        this.process = process;
        this.mapper = mapper;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        startDaemon("pi-stdout-" + process.pid(), this::readStdout);
        startDaemon("pi-stderr-" + process.pid(), this::drainStderr);
    }

    /**
     * Launcher that starts {@code <command> [args...] --mode rpc [--session <file>]}
     * in the requested working directory.
     */
    public static PiProcessLauncher launcher(String command, List<String> extraArgs, ObjectMapper mapper) {
        return request -> spawn(request, command, extraArgs, mapper);
    }

    public static PiRpcProcess spawn(PiSpawnRequest request, String command, List<String> extraArgs,
            ObjectMapper mapper) {
        List<String> argv = buildCommand(command, extraArgs, request.sessionPath());
        ProcessBuilder builder = new ProcessBuilder(argv);
        if (request.cwd() != null && !request.cwd().isBlank()) {
            builder.directory(Path.of(request.cwd()).toFile());
        }
        try {
            Process process = builder.start();
            log.info("pi:spawn pid={} cwd={} session={}", process.pid(), request.cwd(), request.sessionPath());
            return new PiRpcProcess(process, mapper);
        } catch (IOException e) {
            throw new PiRpcException("spawn", "Failed to start pi (" + command + "): " + e.getMessage(), e);
        }
    }

    static List<String> buildCommand(String command, List<String> extraArgs, Path sessionPath) {
        List<String> argv = new ArrayList<>();
        argv.add(command);
        if (extraArgs != null) {
            argv.addAll(extraArgs);
        }
        argv.add("--mode");
        argv.add("rpc");
        if (sessionPath != null) {
            argv.add("--session");
            argv.add(sessionPath.toString());
        }
        return argv;
    }

    // ── Commands ────────────────────────────────────────────────

    @Override
    public CompletableFuture<Void> prompt(String message, List<PiImage> images) {
        ObjectNode cmd = mapper.createObjectNode();
        cmd.put("message", message);
        if (images != null && !images.isEmpty()) {
            cmd.set("images", mapper.valueToTree(images));
        }
        return send("prompt", cmd).thenApply(data -> null);
    }

    @Override
    public CompletableFuture<Void> steer(String message) {
        ObjectNode cmd = mapper.createObjectNode();
        cmd.put("message", message);
        return send("steer", cmd).thenApply(data -> null);
    }

    @Override
    public CompletableFuture<Void> abort() {
        return send("abort", mapper.createObjectNode()).thenApply(data -> null);
    }

    @Override
    public CompletableFuture<List<JsonNode>> getMessages() {
        return send("get_messages", mapper.createObjectNode())
                .thenApply(data -> toList(data.path("messages")));
    }

    @Override
    public CompletableFuture<List<JsonNode>> getAvailableModels() {
        return send("get_available_models", mapper.createObjectNode())
                .thenApply(data -> toList(data.path("models")));
    }

    @Override
    public CompletableFuture<PiState> getState() {
        return send("get_state", mapper.createObjectNode())
                .thenApply(data -> mapper.convertValue(data, PiState.class));
    }

    @Override
    public CompletableFuture<Void> setSessionName(String name) {
        ObjectNode cmd = mapper.createObjectNode();
        cmd.put("name", name);
        return send("set_session_name", cmd).thenApply(data -> null);
    }

    @Override
    public CompletableFuture<Void> respondToUiRequest(String requestId, JsonNode response) {
        ObjectNode cmd = mapper.createObjectNode();
        if (response != null && response.isObject()) {
            cmd.setAll((ObjectNode) response);
        }
        // extension_ui_response is correlated by the request id, not a fresh one
        cmd.put("type", "extension_ui_response");
        cmd.put("id", requestId);
        try {
            write(cmd);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new PiRpcException("extension_ui_response", "write failed: " + e.getMessage(), e));
        }
    }

    @Override
    public Runnable onEvent(Consumer<JsonNode> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        listeners.clear();
        failPending("pi process closed");
        process.destroy();
        CompletableFuture.delayedExecutor(KILL_GRACE_MS, TimeUnit.MILLISECONDS).execute(() -> {
            if (process.isAlive()) {
                log.warn("pi:kill pid={} did not exit after SIGTERM", process.pid());
                process.destroyForcibly();
            }
        });
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    // ── Wire ────────────────────────────────────────────────────

    private CompletableFuture<JsonNode> send(String type, ObjectNode cmd) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new PiRpcException(type, "pi process closed"));
        }
        String id = "req_" + requestCounter.incrementAndGet();
        cmd.put("id", id);
        cmd.put("type", type);

        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.put(id, new PendingCommand(type, future));
        try {
            write(cmd);
        } catch (IOException e) {
            pending.remove(id);
            future.completeExceptionally(new PiRpcException(type, "write failed: " + e.getMessage(), e));
        }
        return future;
    }

    private void write(JsonNode cmd) throws IOException {
        String line = mapper.writeValueAsString(cmd);
        synchronized (stdin) {
            stdin.write(line);
            stdin.write('\n');
            stdin.flush();
        }
        log.debug("pi:out {}", cmd.path("type").asText());
    }

    private void readStdout() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.warn("pi:stdout read failed pid={}: {}", process.pid(), e.getMessage());
            }
        }
        onExit();
    }

    void handleLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        JsonNode node;
        try {
            node = mapper.readTree(trimmed);
        } catch (IOException e) {
            log.debug("pi:in non-json line: {}", trimmed);
            return;
        }
        if ("response".equals(node.path("type").asText())) {
            resolve(node);
            return;
        }
        emit(node);
    }

    private void resolve(JsonNode response) {
        String id = response.path("id").asText(null);
        PendingCommand entry = id != null ? pending.remove(id) : null;
        if (entry == null) {
            log.debug("pi:in unmatched response id={} command={}", id, response.path("command").asText());
            return;
        }
        if (response.path("success").asBoolean(false)) {
            entry.future().complete(response.path("data"));
        } else {
            String error = response.path("error").asText("command failed");
            entry.future().completeExceptionally(new PiRpcException(entry.command(), error));
        }
    }

    private void emit(JsonNode event) {
        for (Consumer<JsonNode> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("pi event listener failed type={}: {}", event.path("type").asText(), e.getMessage(), e);
            }
        }
    }

    private void onExit() {
        Integer code = null;
        try {
            if (process.waitFor(KILL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                code = process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("pi:exit pid={} code={}", process.pid(), code);
        failPending("pi process exited (code " + code + ")");
        ObjectNode exit = mapper.createObjectNode();
        exit.put("type", PROCESS_EXIT_EVENT);
        if (code != null) {
            exit.put("code", code);
        }
        emit(exit);
    }

    private void failPending(String reason) {
        for (String id : List.copyOf(pending.keySet())) {
            PendingCommand entry = pending.remove(id);
            if (entry != null) {
                entry.future().completeExceptionally(new PiRpcException(entry.command(), reason));
            }
        }
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("pi:stderr pid={} {}", process.pid(), line);
            }
        } catch (IOException e) {
            log.debug("pi:stderr closed pid={}: {}", process.pid(), e.getMessage());
        }
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(out::add);
        }
        return out;
    }

    private static void startDaemon(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
    }
}
