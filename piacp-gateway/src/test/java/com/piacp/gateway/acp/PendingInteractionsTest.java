package com.piacp.gateway.acp;

import com.piacp.gateway.acp.PendingInteractions.Interaction;
import com.piacp.gateway.acp.PendingInteractions.Kind;
import com.piacp.gateway.acp.PendingInteractions.Outcome;
import com.piacp.gateway.testing.ManualScheduler;
import com.piacp.gateway.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link PendingInteractions}.
 */
class PendingInteractionsTest {

    private final MutableClock clock = new MutableClock(10_000);
    private final ManualScheduler scheduler = new ManualScheduler(clock);
    private final PendingInteractions pending = new PendingInteractions(scheduler, clock, 5_000);
    private final List<Interaction> timedOut = new ArrayList<>();

    private Interaction register(String requestId, String toolCallId) {
        return pending.register(requestId, toolCallId, Kind.APPROVAL, "confirm", "Run?", null,
                List.of("Yes", "No"), timedOut::add);
    }

    @Test
    void registeredInteractionCarriesItsDeadline() {
        Interaction interaction = register("ui-1", "call_1");

        assertEquals(10_000, interaction.createdAtMs());
        assertEquals(15_000, interaction.expiresAtMs());
        assertEquals(List.of("Yes", "No"), interaction.options());
        assertEquals(1, pending.size());
    }

    @Test
    void takeByRequestIdOrToolCallId() {
        register("ui-1", "call_1");
        register("ui-2", "call_2");

        assertEquals("ui-1", pending.take("ui-1").interaction().requestId());
        assertEquals("ui-2", pending.take("call_2").interaction().requestId());
        assertEquals(0, pending.size());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void answeredInteractionIsGone() {
        register("ui-1", "call_1");
        pending.take("ui-1");

        assertEquals(Outcome.UNKNOWN, pending.take("ui-1").outcome());
    }

    @Test
    void timeoutRunsTheCallbackOnceAndRemembersTheIds() {
        register("ui-1", "call_1");

        scheduler.advance(4_999);
        assertTrue(timedOut.isEmpty());
        scheduler.advance(1);

        assertEquals(1, timedOut.size());
        assertEquals(0, pending.size());
        assertEquals(Outcome.EXPIRED, pending.take("ui-1").outcome());
        assertEquals(Outcome.EXPIRED, pending.take("call_1").outcome());
    }

    @Test
    void peekDoesNotRemove() {
        register("ui-1", "call_1");

        assertTrue(pending.peek("call_1").isPresent());
        assertEquals(1, pending.size());
        assertTrue(pending.peek("other").isEmpty());
    }

    @Test
    void drainCancelsTimers() {
        register("ui-1", "call_1");
        register("ui-2", null);

        List<Interaction> drained = pending.drain();

        assertEquals(2, drained.size());
        assertEquals(0, pending.size());
        scheduler.advance(10_000);
        assertTrue(timedOut.isEmpty());
    }
}
