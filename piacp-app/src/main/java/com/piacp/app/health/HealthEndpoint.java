package com.piacp.app.health;

import com.piacp.gateway.transport.ConnectionManager;
import com.piacp.gateway.transport.HealthSnapshot;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plain HTTP status endpoint, served next to the WebSocket upgrade path.
 * Only {@code GET} is answered; other methods get 404.
 */
@RestController
public class HealthEndpoint {

    private final ConnectionManager connections;

    public HealthEndpoint(ConnectionManager connections) {
        this.connections = connections;
    }

    @RequestMapping("/health")
    public ResponseEntity<HealthSnapshot> health(HttpMethod method) {
        if (!HttpMethod.GET.equals(method)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(connections.health());
    }
}
