package com.shannon.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShannonMetricsTest {

    private SimpleMeterRegistry registry;
    private ShannonMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ShannonMetrics(registry);
    }

    @Test
    @DisplayName("recordAttempt counts by agent and outcome")
    void recordAttempt() {
        metrics.recordAttempt("recon", "succeeded");
        metrics.recordAttempt("recon", "validation_failed");
        metrics.recordAttempt("recon", "validation_failed");

        var failed = registry.find("shannon.agent.attempts")
                .tag("agent", "recon").tag("outcome", "validation_failed").counter();
        assertNotNull(failed);
        assertEquals(2.0, failed.count());
    }

    @Test
    @DisplayName("recordRollback increments per agent")
    void recordRollback() {
        metrics.recordRollback("xss-vuln");

        var counter = registry.find("shannon.checkpoint.rollbacks").tag("agent", "xss-vuln").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordAgentRun and recordAgentCost track duration and spend")
    void recordAgentRunAndCost() {
        metrics.recordAgentRun("report", "success", 1500);
        metrics.recordAgentCost("report", 0.75);
        metrics.recordAgentCost("report", 0.25);

        var timer = registry.find("shannon.agent.duration").tag("result", "success").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        var cost = registry.find("shannon.agent.cost").tag("agent", "report").summary();
        assertNotNull(cost);
        assertEquals(1.0, cost.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordWaveMember tags wave, member and status")
    void recordWaveMember() {
        metrics.recordWaveMember("initial-footprinting", "nmap", "FAILED", 300);

        var timer = registry.find("shannon.wave.member.duration")
                .tag("wave", "initial-footprinting").tag("member", "nmap").tag("status", "FAILED").timer();
        assertNotNull(timer);
    }

    @Test
    @DisplayName("recordSessionResult counts by status")
    void recordSessionResult() {
        metrics.recordSessionResult("completed");
        metrics.recordSessionResult("cancelled");

        assertEquals(1.0, registry.find("shannon.sessions.total").tag("status", "cancelled").counter().count());
    }
}
