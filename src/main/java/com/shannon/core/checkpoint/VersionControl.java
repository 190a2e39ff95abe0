package com.shannon.core.checkpoint;

import com.shannon.core.error.StorageException;
import com.shannon.core.model.CommitRef;

import java.nio.file.Path;

/**
 * Snapshot backend for a workspace. Every method throws {@link StorageException} when the
 * backend cannot complete the operation.
 */
public interface VersionControl {

    /** Makes the workspace a repository with at least one commit, if it is not one already. */
    void ensureRepository(Path workspace);

    /** Records all tracked and untracked changes as a new snapshot, even when nothing changed. */
    CommitRef snapshot(Path workspace, String message);

    /**
     * Discards tracked changes and removes every file created since {@code ref} was taken, ignored ones
     * included, so the workspace matches {@code ref}.
     */
    void restore(Path workspace, CommitRef ref);

    CommitRef head(Path workspace);
}
