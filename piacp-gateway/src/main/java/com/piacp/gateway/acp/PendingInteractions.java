package com.piacp.gateway.acp;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Approval and user-input requests raised by pi that wait on the client,
 * each with a timeout. Entries are addressable by pi's request id or by the
 * tool call they belong to.
 */
@Slf4j
public class PendingInteractions {

    public enum Kind {
        APPROVAL, INPUT
    }

    public record Interaction(
            String requestId,
            String toolCallId,
            Kind kind,
            String method,
            String title,
            String message,
            List<String> options,
            long createdAtMs,
            long expiresAtMs) {
    }

    public enum Outcome {
        FOUND, EXPIRED, UNKNOWN
    }

    public record Lookup(Outcome outcome, Interaction interaction) {
        static Lookup found(Interaction interaction) {
            return new Lookup(Outcome.FOUND, interaction);
        }
    }

    private record PendingEntry(Interaction interaction, ScheduledFuture<?> timer) {
    }

    private static final int EXPIRED_MEMORY = 256;

    private final Map<String, PendingEntry> pending = new ConcurrentHashMap<>();
    private final Set<String> expired = new LinkedHashSet<>();
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long timeoutMs;

    public PendingInteractions(ScheduledExecutorService scheduler, Clock clock, long timeoutMs) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * Create and arm an interaction. {@code onTimeout} runs if nobody answers
     * before the deadline.
     */
    public Interaction register(String requestId, String toolCallId, Kind kind, String method,
            String title, String message, List<String> options, Consumer<Interaction> onTimeout) {
        long now = clock.millis();
        Interaction interaction = new Interaction(requestId, toolCallId, kind, method, title, message,
                options != null ? List.copyOf(options) : List.of(), now, now + timeoutMs);
        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (pending.remove(requestId) != null) {
                markExpired(interaction);
                log.info("acp:interaction timeout request={} toolCall={}", requestId, toolCallId);
                onTimeout.accept(interaction);
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        pending.put(requestId, new PendingEntry(interaction, timer));
        return interaction;
    }

    /**
     * Remove and return the interaction addressed by {@code id}, which may be
     * either the request id or the tool call id.
     */
    public Lookup take(String id) {
        PendingEntry entry = pending.remove(id);
        if (entry == null) {
            entry = findByToolCall(id)
                    .map(found -> pending.remove(found.interaction().requestId()))
                    .orElse(null);
        }
        if (entry != null) {
            entry.timer().cancel(false);
            return Lookup.found(entry.interaction());
        }
        synchronized (expired) {
            if (expired.contains(id)) {
                return new Lookup(Outcome.EXPIRED, null);
            }
        }
        return new Lookup(Outcome.UNKNOWN, null);
    }

    public Optional<Interaction> peek(String id) {
        PendingEntry entry = pending.get(id);
        if (entry != null) {
            return Optional.of(entry.interaction());
        }
        return findByToolCall(id).map(PendingEntry::interaction);
    }

    public int size() {
        return pending.size();
    }

    /** Cancel every timer and hand back what was still waiting. */
    public List<Interaction> drain() {
        List<Interaction> drained = pending.values().stream().map(PendingEntry::interaction).toList();
        pending.values().forEach(entry -> entry.timer().cancel(false));
        pending.clear();
        return drained;
    }

    private Optional<PendingEntry> findByToolCall(String toolCallId) {
        return pending.values().stream()
                .filter(entry -> toolCallId.equals(entry.interaction().toolCallId()))
                .findFirst();
    }

    private void markExpired(Interaction interaction) {
        synchronized (expired) {
            expired.add(interaction.requestId());
            if (interaction.toolCallId() != null) {
                expired.add(interaction.toolCallId());
            }
            while (expired.size() > EXPIRED_MEMORY) {
                String oldest = expired.iterator().next();
                expired.remove(oldest);
            }
        }
    }
}
