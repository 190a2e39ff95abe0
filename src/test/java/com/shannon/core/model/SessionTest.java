package com.shannon.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private final Session fresh = Session.create("https://app.example.com", "/work/app");

    @Test
    @DisplayName("a completed agent leaves the failed list and keeps its checkpoint")
    void completedClearsFailure() {
        Session session = fresh.withFailed("recon", 100, 0.2)
                .withCompleted("recon", new CommitRef("abc"), 300, 0.5);

        assertTrue(session.isCompleted("recon"));
        assertFalse(session.isFailed("recon"));
        assertEquals("abc", session.checkpointOf("recon").orElseThrow().value());
        assertEquals(400, session.agentDurationsMs().get("recon"));
        assertEquals(0.7, session.agentCostsUsd().get("recon"), 1e-9);
        assertEquals(SessionStatus.IN_PROGRESS, session.status());
    }

    @Test
    @DisplayName("failing an already completed agent changes nothing")
    void failAfterCompleteIsIgnored() {
        Session completed = fresh.withCompleted("recon", new CommitRef("abc"), 10, 0.1);

        assertSame(completed, completed.withFailed("recon", 10, 0.1));
    }

    @Test
    @DisplayName("completing twice does not duplicate the agent")
    void completeIsIdempotentForMembership() {
        Session session = fresh.withCompleted("recon", null, 10, 0.1).withCompleted("recon", null, 10, 0.1);

        assertEquals(List.of("recon"), session.completedAgents());
        assertTrue(session.checkpointOf("recon").isEmpty());
    }

    @Test
    @DisplayName("without forgets agents entirely")
    void withoutRemovesTraces() {
        Session session = fresh.withCompleted("pre-recon", new CommitRef("a"), 10, 0.1)
                .withCompleted("recon", new CommitRef("b"), 20, 0.2)
                .without(List.of("recon"));

        assertEquals(List.of("pre-recon"), session.completedAgents());
        assertTrue(session.checkpointOf("recon").isEmpty());
        assertEquals(10, session.totalDurationMs());
        assertEquals(0.1, session.totalCostUsd(), 1e-9);
    }

    @Test
    @DisplayName("collections are immutable copies")
    void immutable() {
        Session session = fresh.withCompleted("recon", null, 10, 0.1);

        assertThrows(UnsupportedOperationException.class, () -> session.completedAgents().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> session.checkpoints().put("x", "y"));
    }
}
