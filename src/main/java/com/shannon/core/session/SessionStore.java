package com.shannon.core.session;

import com.shannon.core.model.Session;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for sessions. {@link #save} raises
 * {@link com.shannon.core.error.PersistenceException} when the session could not be written.
 */
public interface SessionStore {

    void save(Session session);

    Optional<Session> load(String sessionId);

    List<Session> list();

    /** Most recently updated unfinished session for the same target and workspace. */
    Optional<Session> findResumable(String targetRef, String workspaceRef);
}
