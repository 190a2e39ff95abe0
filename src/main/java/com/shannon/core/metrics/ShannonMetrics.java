package com.shannon.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent runs and scan waves.
 */
@Service
public class ShannonMetrics {

    private final MeterRegistry registry;

    public ShannonMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "success", "execution_failed" or "validation_failed"
     */
    public void recordAttempt(String agentName, String outcome) {
        Counter.builder("shannon.agent.attempts")
                .tag("agent", agentName)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRollback(String agentName) {
        Counter.builder("shannon.checkpoint.rollbacks")
                .description("Workspace rollbacks after a failed attempt")
                .tag("agent", agentName)
                .register(registry)
                .increment();
    }

    public void recordAgentRun(String agentName, String result, long durationMs) {
        Timer.builder("shannon.agent.duration")
                .tag("agent", agentName)
                .tag("result", result)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordAgentCost(String agentName, double costUsd) {
        DistributionSummary.builder("shannon.agent.cost")
                .baseUnit("usd")
                .tag("agent", agentName)
                .register(registry)
                .record(costUsd);
    }

    public void recordWaveMember(String wave, String member, String status, long durationMs) {
        Timer.builder("shannon.wave.member.duration")
                .tag("wave", wave)
                .tag("member", member)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordSessionResult(String status) {
        Counter.builder("shannon.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
