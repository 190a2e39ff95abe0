package com.shannon.core.session;

import com.shannon.core.checkpoint.CheckpointStore;
import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.CommitRef;
import com.shannon.core.model.Phase;
import com.shannon.core.model.Session;
import com.shannon.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which agents of a session are done and decides where a run resumes.
 * <p>
 * Updates from agents of the same parallel phase arrive concurrently, so each update is applied to the
 * latest known version of the session under a lock and persisted before it becomes visible.
 */
@Service
public class SessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    private final SessionStore store;
    private final CheckpointStore checkpointStore;
    private final Map<String, Session> latest = new ConcurrentHashMap<>();

    public SessionStateMachine(SessionStore store, CheckpointStore checkpointStore) {
        this.store = store;
        this.checkpointStore = checkpointStore;
    }

    /**
     * Resumes the unfinished session for this target and workspace, or creates and persists a new one.
     */
    public Session openSession(String targetRef, Path workspace) {
        return openSession(targetRef, workspace, true);
    }

    /**
     * @param resume false to always start a new session even when an unfinished one exists
     */
    public Session openSession(String targetRef, Path workspace, boolean resume) {
        String workspaceRef = workspace.toAbsolutePath().normalize().toString();
        Optional<Session> existing = resume ? store.findResumable(targetRef, workspaceRef) : Optional.empty();
        if (existing.isPresent()) {
            Session session = existing.get();
            log.info("Resuming session {} ({} of {} agents completed)", session.id(),
                    session.completedAgents().size(), AgentCatalog.all().size());
            latest.put(session.id(), session);
            return session;
        }
        Session session = Session.create(targetRef, workspaceRef);
        persist(session);
        log.info("Created session {} for {}", session.id(), targetRef);
        return session;
    }

    /** The first agent in catalog order that has not completed. */
    public Optional<AgentDefinition> getNextAgent(Session session) {
        return AgentCatalog.all().stream()
                .filter(agent -> !session.isCompleted(agent.name()))
                .findFirst();
    }

    public Phase phaseOf(String agentName) {
        return AgentCatalog.require(agentName).phase();
    }

    /** Phase to resume from, or empty when every agent has completed. */
    public Optional<Phase> startPhase(Session session) {
        return getNextAgent(session).map(AgentDefinition::phase);
    }

    /** Agents of the phase that still need to run, in catalog order. */
    public List<AgentDefinition> pendingAgents(Session session, Phase phase) {
        return AgentCatalog.inPhase(phase).stream()
                .filter(agent -> !session.isCompleted(agent.name()))
                .toList();
    }

    /**
     * Records a completed agent and persists the session.
     *
     * @param checkpoint the commit to remember for later rewinds; null when the agent produced none
     */
    public synchronized Session updateProgress(Session session, String agentName, CommitRef checkpoint,
                                               long durationMs, double costUsd) {
        AgentCatalog.require(agentName);
        Session updated = current(session).withCompleted(agentName, checkpoint, durationMs, costUsd);
        persist(updated);
        log.info("Session {}: {} completed ({} of {})", updated.id(), agentName,
                updated.completedAgents().size(), AgentCatalog.all().size());
        return updated;
    }

    public Session updateProgress(Session session, String agentName, CommitRef checkpoint) {
        return updateProgress(session, agentName, checkpoint, 0L, 0.0);
    }

    public synchronized Session markFailed(Session session, String agentName, long durationMs, double costUsd) {
        AgentCatalog.require(agentName);
        Session updated = current(session).withFailed(agentName, durationMs, costUsd);
        persist(updated);
        log.warn("Session {}: {} marked failed", updated.id(), agentName);
        return updated;
    }

    public synchronized Session complete(Session session) {
        Session updated = current(session).withStatus(SessionStatus.COMPLETED);
        persist(updated);
        log.info("Session {} completed in {}ms, ${}", updated.id(), updated.totalDurationMs(),
                String.format("%.4f", updated.totalCostUsd()));
        return updated;
    }

    /**
     * Rewinds the session to just after {@code agentName} completed: the workspace is restored to that
     * agent's checkpoint and every later agent is forgotten.
     *
     * @throws IllegalStateException when the agent has no recorded checkpoint
     */
    public synchronized Session rollbackTo(Session session, String agentName) {
        AgentCatalog.require(agentName);
        Session base = current(session);
        CommitRef ref = base.checkpointOf(agentName).orElseThrow(() -> new IllegalStateException(
                "Agent '" + agentName + "' has no checkpoint in session " + base.id()));

        checkpointStore.restoreTo(Path.of(base.workspaceRef()), ref);

        int index = AgentCatalog.indexOf(agentName);
        var later = new ArrayList<String>();
        for (AgentDefinition agent : AgentCatalog.all()) {
            if (AgentCatalog.indexOf(agent.name()) > index) {
                later.add(agent.name());
            }
        }
        Session updated = base.without(later);
        persist(updated);
        log.warn("Session {} rolled back to {} ({}), forgot {}", updated.id(), agentName, ref.shortValue(), later);
        return updated;
    }

    /** The latest persisted version of the session, including updates made by other threads. */
    public Session refresh(Session session) {
        return current(session);
    }

    private Session current(Session session) {
        return latest.getOrDefault(session.id(), session);
    }

    private void persist(Session session) {
        store.save(session);
        latest.put(session.id(), session);
    }
}
