package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Records notifications; deferred tasks run only when the test calls
 * {@link #flush()}, standing in for "the response was written".
 */
class FakeAcpClient implements AcpClient {

    record Update(String sessionId, ObjectNode update) {
        String kind() {
            return update.path("sessionUpdate").asText();
        }
    }

    final List<Update> updates = new ArrayList<>();
    final List<Runnable> deferred = new ArrayList<>();

    @Override
    public synchronized void sessionUpdate(String sessionId, ObjectNode update) {
        updates.add(new Update(sessionId, update));
    }

    @Override
    public synchronized void afterResponse(Runnable task) {
        deferred.add(task);
    }

    void flush() {
        List<Runnable> tasks;
        synchronized (this) {
            tasks = List.copyOf(deferred);
            deferred.clear();
        }
        tasks.forEach(Runnable::run);
    }

    synchronized List<Update> ofKind(String kind) {
        return updates.stream().filter(update -> kind.equals(update.kind())).toList();
    }

    synchronized Update last() {
        return updates.get(updates.size() - 1);
    }

    synchronized Update lastOfKind(String kind) {
        List<Update> matching = ofKind(kind);
        return matching.get(matching.size() - 1);
    }
}
