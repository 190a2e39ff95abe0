package com.shannon.core.checkpoint;

import com.shannon.core.error.StorageException;
import com.shannon.core.metrics.ShannonMetrics;
import com.shannon.core.model.CommitRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Captures and restores workspace snapshots around agent attempts.
 * <p>
 * Mutations of one workspace (snapshot, commit, restore) hold that workspace's write lock; readers that
 * inspect deliverables go through {@link #read(Path, Supplier)} and so only ever observe the state before
 * or after a rollback, never a half-restored tree.
 */
@Service
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final VersionControl versionControl;
    private final ShannonMetrics metrics;

    private final Map<Path, WorkspaceState> workspaces = new ConcurrentHashMap<>();

    public CheckpointStore(VersionControl versionControl, @Autowired(required = false) ShannonMetrics metrics) {
        this.versionControl = versionControl;
        this.metrics = metrics;
    }

    public void prepare(Path workspace) {
        mutate(workspace, () -> {
            versionControl.ensureRepository(workspace);
            return null;
        });
    }

    /**
     * Snapshots the workspace before an attempt and remembers it as the agent's rollback target.
     */
    public CommitRef checkpoint(Path workspace, String agentName, int attemptNumber) {
        return mutate(workspace, () -> {
            CommitRef ref = versionControl.snapshot(workspace,
                    "Checkpoint: " + agentName + " (attempt " + attemptNumber + ")");
            WorkspaceState state = state(workspace);
            state.latest = ref;
            state.byAgent.put(agentName, ref);
            log.info("Checkpoint {} for {} attempt {}", ref.shortValue(), agentName, attemptNumber);
            return ref;
        });
    }

    /**
     * Finalises the current workspace as the accepted result of the agent.
     */
    public CommitRef commitSuccess(Path workspace, String agentName) {
        return mutate(workspace, () -> {
            CommitRef ref = versionControl.snapshot(workspace, "Success: " + agentName);
            WorkspaceState state = state(workspace);
            state.latest = ref;
            state.byAgent.put(agentName, ref);
            log.info("Committed successful result of {} as {}", agentName, ref.shortValue());
            return ref;
        });
    }

    /**
     * Restores the most recent checkpoint taken for the agent, falling back to the workspace's most recent
     * checkpoint and then to HEAD. Calling it twice in a row leaves the workspace unchanged the second time.
     */
    public void rollback(Path workspace, String agentName, String reason) {
        mutate(workspace, () -> {
            WorkspaceState state = state(workspace);
            CommitRef target = state.byAgent.get(agentName);
            if (target == null) {
                target = state.latest != null ? state.latest : versionControl.head(workspace);
            }
            log.warn("Rolling back {} to {}: {}", agentName, target.shortValue(), reason);
            versionControl.restore(workspace, target);
            if (metrics != null) {
                metrics.recordRollback(agentName);
            }
            return null;
        });
    }

    /** Restores the most recent checkpoint of the workspace regardless of agent. */
    public void rollback(Path workspace, String reason) {
        mutate(workspace, () -> {
            WorkspaceState state = state(workspace);
            CommitRef target = state.latest != null ? state.latest : versionControl.head(workspace);
            log.warn("Rolling back workspace to {}: {}", target.shortValue(), reason);
            versionControl.restore(workspace, target);
            return null;
        });
    }

    /** Restores an explicit earlier commit, used when rewinding a session to a completed agent. */
    public void restoreTo(Path workspace, CommitRef ref) {
        mutate(workspace, () -> {
            log.warn("Restoring workspace {} to {}", workspace, ref.shortValue());
            versionControl.restore(workspace, ref);
            WorkspaceState state = state(workspace);
            state.latest = ref;
            state.byAgent.clear();
            return null;
        });
    }

    /**
     * Runs a read-only action on the workspace while no snapshot operation is in progress.
     */
    public <T> T read(Path workspace, Supplier<T> action) {
        var lock = state(workspace).lock.readLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T mutate(Path workspace, Supplier<T> action) {
        var lock = state(workspace).lock.writeLock();
        lock.lock();
        try {
            return action.get();
        } catch (StorageException e) {
            log.error("Checkpoint storage failure in {}: {}", workspace, e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private WorkspaceState state(Path workspace) {
        return workspaces.computeIfAbsent(workspace.toAbsolutePath().normalize(), k -> new WorkspaceState());
    }

    private static final class WorkspaceState {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Map<String, CommitRef> byAgent = new ConcurrentHashMap<>();
        private volatile CommitRef latest;
    }
}
