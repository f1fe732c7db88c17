package com.piacp.gateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piacp.gateway.acp.BridgeContext;
import com.piacp.gateway.pi.PiState;
import com.piacp.gateway.session.SessionDirectory;
import com.piacp.gateway.testing.FakePiProcess;
import com.piacp.gateway.testing.ManualScheduler;
import com.piacp.gateway.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AcpRpcEndpoint}: framing, error mapping and message
 * ordering over the real method table. Runs on a same-thread executor.
 */
class AcpRpcEndpointTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path temp;

    private final List<String> outbound = new ArrayList<>();
    private final FakePiProcess process = new FakePiProcess();
    private AcpRpcEndpoint endpoint;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(0);
        process.state = PiState.builder().sessionId("s-1").build();
        BridgeContext context = BridgeContext.builder()
                .mapper(mapper)
                .sessions(new SessionDirectory(temp.resolve("sessions"), mapper))
                .launcher(request -> process)
                .promptsDir(temp.resolve("prompts"))
                .scheduler(new ManualScheduler(clock))
                .clock(clock)
                .build();
        endpoint = new AcpRpcEndpoint("conn-1", AcpMethods.createRouter(), context, outbound::add, Runnable::run);
    }

    private void send(String frame) throws Exception {
        endpoint.onMessage(mapper.readTree(frame));
    }

    private List<JsonNode> written() throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        for (String text : outbound) {
            nodes.add(mapper.readTree(text));
        }
        return nodes;
    }

    private JsonNode lastWritten() throws Exception {
        List<JsonNode> nodes = written();
        return nodes.get(nodes.size() - 1);
    }

    private void initialize() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":1}}");
    }

    private void newSession() throws Exception {
        initialize();
        send("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"session/new\",\"params\":{\"cwd\":\"/work\"}}");
    }

    @Nested
    class Responses {

        @Test
        void initializeIsAnsweredWithTheSameId() throws Exception {
            send("{\"jsonrpc\":\"2.0\",\"id\":\"init-1\",\"method\":\"initialize\",\"params\":{}}");

            JsonNode response = lastWritten();
            assertEquals("2.0", response.get("jsonrpc").asText());
            assertEquals("init-1", response.get("id").asText());
            assertEquals(1, response.at("/result/protocolVersion").asInt());
            assertFalse(response.has("error"));
        }

        @Test
        void unknownMethodIsMethodNotFound() throws Exception {
            send("{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"session/fork\"}");

            JsonNode response = lastWritten();
            assertEquals(9, response.get("id").asInt());
            assertEquals(-32601, response.at("/error/code").asInt());
            assertEquals("session/fork", response.at("/error/data/method").asText());
        }

        @Test
        void invalidEnvelopeIsInvalidRequest() throws Exception {
            send("{\"id\":5,\"method\":\"initialize\"}");

            JsonNode response = lastWritten();
            assertEquals(5, response.get("id").asInt());
            assertEquals(-32600, response.at("/error/code").asInt());
        }

        @Test
        void callsBeforeInitializeAreRejected() throws Exception {
            send("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"session/list\",\"params\":{}}");

            assertEquals(-32004, lastWritten().at("/error/code").asInt());
        }

        @Test
        void notificationSentAsRequestGetsANullResult() throws Exception {
            initialize();
            send("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"session/cancel\",\"params\":{\"sessionId\":\"x\"}}");

            JsonNode response = lastWritten();
            assertEquals(4, response.get("id").asInt());
            assertTrue(response.has("result"));
            assertTrue(response.get("result").isNull());
        }

        @Test
        void notificationsAndClientResponsesAreNotAnswered() throws Exception {
            send("{\"jsonrpc\":\"2.0\",\"method\":\"initialized\"}");
            send("{\"jsonrpc\":\"2.0\",\"method\":\"no/such/notification\"}");
            send("{\"jsonrpc\":\"2.0\",\"id\":77,\"result\":{}}");

            assertTrue(outbound.isEmpty());
        }
    }

    @Nested
    class Ordering {

        @Test
        void sessionNotificationsFollowTheNewSessionResponse() throws Exception {
            newSession();

            List<JsonNode> frames = written();
            assertEquals(4, frames.size());
            assertEquals(2, frames.get(1).get("id").asInt());
            assertEquals("s-1", frames.get(1).at("/result/sessionId").asText());
            assertEquals("session/update", frames.get(2).get("method").asText());
            assertEquals("agent_message_chunk", frames.get(2).at("/params/update/sessionUpdate").asText());
            assertEquals("s-1", frames.get(2).at("/params/sessionId").asText());
            assertEquals("available_commands_update", frames.get(3).at("/params/update/sessionUpdate").asText());
        }

        @Test
        void cancelReachesARunningPrompt() throws Exception {
            newSession();
            send("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"session/prompt\","
                    + "\"params\":{\"sessionId\":\"s-1\",\"prompt\":[{\"type\":\"text\",\"text\":\"go\"}]}}");
            int beforeCancel = outbound.size();

            send("{\"jsonrpc\":\"2.0\",\"method\":\"session/cancel\",\"params\":{\"sessionId\":\"s-1\"}}");

            assertEquals(List.of("go"), process.prompts);
            assertEquals(beforeCancel + 1, outbound.size());
            JsonNode response = lastWritten();
            assertEquals(3, response.get("id").asInt());
            assertEquals("cancelled", response.at("/result/stopReason").asText());
            assertEquals(1, process.aborts);
        }

        @Test
        void liveEventsAreWrittenAsSessionUpdates() throws Exception {
            newSession();
            send("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"session/prompt\","
                    + "\"params\":{\"sessionId\":\"s-1\",\"prompt\":[{\"type\":\"text\",\"text\":\"go\"}]}}");

            process.emit(mapper.readTree("{\"type\":\"message_update\","
                    + "\"assistantMessageEvent\":{\"type\":\"text_delta\",\"delta\":\"working\"}}"));
            process.emit(mapper.readTree("{\"type\":\"agent_end\"}"));

            List<JsonNode> frames = written();
            JsonNode chunk = frames.get(frames.size() - 2);
            assertEquals("working", chunk.at("/params/update/content/text").asText());
            assertEquals("end_turn", frames.get(frames.size() - 1).at("/result/stopReason").asText());
        }
    }

    @Test
    void closingTheConnectionClosesTheSession() throws Exception {
        newSession();

        endpoint.onClose();

        assertTrue(process.closed);
    }
}
