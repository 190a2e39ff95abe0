package com.shannon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable progress record for one pipeline run against one target and workspace.
 * <p>
 * Invariants: an agent name appears in at most one of {@code completedAgents} and {@code failedAgents};
 * every key of {@code checkpoints} is a completed agent.
 *
 * @param id               session identifier
 * @param targetRef        the target under test (a URL)
 * @param workspaceRef     absolute path of the workspace the agents operate on
 * @param completedAgents  agents that finished and passed validation, in completion order
 * @param failedAgents     agents whose last run ended in a terminal failure
 * @param checkpoints      agent name to the commit recorded when it succeeded
 * @param status           lifecycle status
 * @param agentDurationsMs agent name to total time spent across attempts
 * @param agentCostsUsd    agent name to total cost across attempts
 * @param createdAt        creation time
 * @param updatedAt        last persisted change
 */
public record Session(
    String id,
    String targetRef,
    String workspaceRef,
    List<String> completedAgents,
    List<String> failedAgents,
    Map<String, String> checkpoints,
    SessionStatus status,
    Map<String, Long> agentDurationsMs,
    Map<String, Double> agentCostsUsd,
    Instant createdAt,
    Instant updatedAt
) {

    public Session {
        completedAgents = completedAgents == null ? List.of() : List.copyOf(completedAgents);
        failedAgents = failedAgents == null ? List.of() : List.copyOf(failedAgents);
        checkpoints = checkpoints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checkpoints));
        agentDurationsMs = agentDurationsMs == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(agentDurationsMs));
        agentCostsUsd = agentCostsUsd == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(agentCostsUsd));
        status = status == null ? SessionStatus.PENDING : status;
    }

    public static Session create(String targetRef, String workspaceRef) {
        Instant now = Instant.now();
        return new Session(UUID.randomUUID().toString(), targetRef, workspaceRef,
                List.of(), List.of(), Map.of(), SessionStatus.PENDING, Map.of(), Map.of(), now, now);
    }

    public boolean isCompleted(String agentName) {
        return completedAgents.contains(agentName);
    }

    public boolean isFailed(String agentName) {
        return failedAgents.contains(agentName);
    }

    public Optional<CommitRef> checkpointOf(String agentName) {
        String ref = checkpoints.get(agentName);
        return ref == null ? Optional.empty() : Optional.of(new CommitRef(ref));
    }

    @JsonIgnore
    public long totalDurationMs() {
        return agentDurationsMs.values().stream().mapToLong(Long::longValue).sum();
    }

    @JsonIgnore
    public double totalCostUsd() {
        return agentCostsUsd.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Records a successful agent: moves it to completed, clears any previous failure and
     * stores the checkpoint when one is given.
     */
    public Session withCompleted(String agentName, CommitRef checkpoint, long durationMs, double costUsd) {
        var completed = new ArrayList<>(completedAgents);
        if (!completed.contains(agentName)) {
            completed.add(agentName);
        }
        var failed = new ArrayList<>(failedAgents);
        failed.remove(agentName);
        var refs = new LinkedHashMap<>(checkpoints);
        if (checkpoint != null) {
            refs.put(agentName, checkpoint.value());
        }
        var durations = new LinkedHashMap<>(agentDurationsMs);
        durations.merge(agentName, durationMs, Long::sum);
        var costs = new LinkedHashMap<>(agentCostsUsd);
        costs.merge(agentName, costUsd, Double::sum);
        return new Session(id, targetRef, workspaceRef, completed, failed, refs,
                SessionStatus.IN_PROGRESS, durations, costs, createdAt, Instant.now());
    }

    /** Records a terminal failure. A completed agent is left untouched. */
    public Session withFailed(String agentName, long durationMs, double costUsd) {
        if (completedAgents.contains(agentName)) {
            return this;
        }
        var failed = new ArrayList<>(failedAgents);
        if (!failed.contains(agentName)) {
            failed.add(agentName);
        }
        var durations = new LinkedHashMap<>(agentDurationsMs);
        durations.merge(agentName, durationMs, Long::sum);
        var costs = new LinkedHashMap<>(agentCostsUsd);
        costs.merge(agentName, costUsd, Double::sum);
        return new Session(id, targetRef, workspaceRef, completedAgents, failed, checkpoints,
                SessionStatus.IN_PROGRESS, durations, costs, createdAt, Instant.now());
    }

    /** Drops every trace of the given agents, as if they never ran. */
    public Session without(Collection<String> agentNames) {
        var completed = new ArrayList<>(completedAgents);
        completed.removeAll(agentNames);
        var failed = new ArrayList<>(failedAgents);
        failed.removeAll(agentNames);
        var refs = new LinkedHashMap<>(checkpoints);
        var durations = new LinkedHashMap<>(agentDurationsMs);
        var costs = new LinkedHashMap<>(agentCostsUsd);
        for (String name : agentNames) {
            refs.remove(name);
            durations.remove(name);
            costs.remove(name);
        }
        return new Session(id, targetRef, workspaceRef, completed, failed, refs,
                SessionStatus.IN_PROGRESS, durations, costs, createdAt, Instant.now());
    }

    public Session withStatus(SessionStatus newStatus) {
        return new Session(id, targetRef, workspaceRef, completedAgents, failedAgents, checkpoints,
                newStatus, agentDurationsMs, agentCostsUsd, createdAt, Instant.now());
    }
}
