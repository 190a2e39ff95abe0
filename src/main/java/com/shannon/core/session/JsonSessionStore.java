package com.shannon.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shannon.config.ShannonProperties;
import com.shannon.core.error.PersistenceException;
import com.shannon.core.model.Session;
import com.shannon.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON document per session in a directory. Writes go to a temporary file first and are moved
 * into place atomically, so a crash leaves either the old or the new document.
 */
@Component
public class JsonSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonSessionStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonSessionStore(ShannonProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getSessionsDir()), objectMapper);
    }

    JsonSessionStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void save(Session session) {
        Path file = fileFor(session.id());
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, session.id(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), session);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved session {} ({} completed)", session.id(), session.completedAgents().size());
        } catch (IOException e) {
            throw new PersistenceException("Failed to save session " + session.id() + " to " + file, e);
        }
    }

    @Override
    public Optional<Session> load(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Session.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read session " + sessionId + " from " + file, e);
        }
    }

    @Override
    public List<Session> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        var sessions = new ArrayList<Session>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(".json")).toList()) {
                try {
                    sessions.add(objectMapper.readValue(file.toFile(), Session.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable session file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list sessions in " + directory, e);
        }
        sessions.sort(Comparator.comparing(Session::updatedAt).reversed());
        return sessions;
    }

    @Override
    public Optional<Session> findResumable(String targetRef, String workspaceRef) {
        return list().stream()
                .filter(s -> s.status() != SessionStatus.COMPLETED)
                .filter(s -> s.targetRef().equals(targetRef) && s.workspaceRef().equals(workspaceRef))
                .findFirst();
    }

    private Path fileFor(String sessionId) {
        return directory.resolve(sessionId + ".json");
    }
}
