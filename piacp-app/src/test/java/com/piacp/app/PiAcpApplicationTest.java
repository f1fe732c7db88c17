package com.piacp.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole bridge on a random port and talks to it over HTTP and
 * WebSocket. No pi process is started: only calls that do not open a
 * session are made.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "piacp.sessions.dir=${java.io.tmpdir}/piacp-test-no-sessions",
        "piacp.pi.command=pi-not-installed",
        "piacp.shutdown.force-exit=false"
})
class PiAcpApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void healthReportsStatus() throws Exception {
        ResponseEntity<String> response = rest.getForEntity("/health", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = mapper.readTree(response.getBody());
        assertEquals("healthy", body.get("status").asText());
        assertEquals(10, body.get("maxConnections").asInt());
        assertTrue(body.get("connections").asInt() >= 0);
        assertTrue(body.get("uptime").asLong() >= 0);
        assertTrue(body.hasNonNull("timestamp"));
    }

    @Test
    void healthOnlyAnswersGet() {
        ResponseEntity<String> response = rest.postForEntity("/health", "{}", String.class);
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void plainRequestToTheSocketPathIsNotFound() {
        ResponseEntity<String> response = rest.getForEntity("/", String.class);
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void initializeOverWebSocket() throws Exception {
        ArrayBlockingQueue<String> messages = new ArrayBlockingQueue<>(10);
        StandardWebSocketClient client = new StandardWebSocketClient();
        WebSocketSession session = client.execute(new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                messages.add(message.getPayload());
            }
        }, new WebSocketHttpHeaders(), URI.create("ws://127.0.0.1:" + port + "/")).get(5, TimeUnit.SECONDS);

        try {
            // keepalive and malformed frames are dropped without a reply
            session.sendMessage(new TextMessage("{\"type\":\"ping\"}"));
            session.sendMessage(new TextMessage("not json"));
            session.sendMessage(new TextMessage(
                    "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":1}}"));

            String reply = messages.poll(5, TimeUnit.SECONDS);
            assertNotNull(reply, "Expected initialize response");
            JsonNode response = mapper.readTree(reply);
            assertEquals(1, response.get("id").asInt());
            assertEquals(1, response.at("/result/protocolVersion").asInt());
            assertTrue(response.at("/result/agentCapabilities/loadSession").asBoolean());

            session.sendMessage(new TextMessage(
                    "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"session/list\",\"params\":{}}"));
            JsonNode list = mapper.readTree(messages.poll(5, TimeUnit.SECONDS));
            assertEquals(2, list.get("id").asInt());
            assertEquals(0, list.at("/result/sessions").size());

            session.sendMessage(new TextMessage("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"nope\"}"));
            JsonNode error = mapper.readTree(messages.poll(5, TimeUnit.SECONDS));
            assertEquals(-32601, error.at("/error/code").asInt());
        } finally {
            session.close(CloseStatus.NORMAL);
        }
    }
}
