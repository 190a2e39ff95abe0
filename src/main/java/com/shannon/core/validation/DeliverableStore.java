package com.shannon.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes files in a workspace's {@code deliverables/} directory.
 */
@Component
public class DeliverableStore {

    private static final Logger log = LoggerFactory.getLogger(DeliverableStore.class);

    private final ObjectMapper objectMapper;

    public DeliverableStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path directory(Path workspace) {
        return workspace.resolve(Deliverables.DIRECTORY);
    }

    public Path path(Path workspace, String name) {
        return directory(workspace).resolve(name);
    }

    /** True when the file exists and is not empty. */
    public boolean exists(Path workspace, String name) {
        Path file = path(workspace, name);
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            log.debug("Could not stat {}: {}", file, e.getMessage());
            return false;
        }
    }

    public Optional<String> read(Path workspace, String name) {
        Path file = path(workspace, name);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read deliverable " + file, e);
        }
    }

    /** Writes through a temporary file so readers never see a partial deliverable. */
    public void write(Path workspace, String name, String content) {
        Path file = path(workspace, name);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), "." + name, ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote deliverable {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write deliverable " + file, e);
        }
    }

    /**
     * Parses an exploitation queue. Empty when the file is missing, is not JSON or has no
     * {@code vulnerabilities} array.
     */
    public Optional<List<JsonNode>> readQueue(Path workspace, String vulnerabilityClass) {
        Optional<String> content = read(workspace, Deliverables.exploitationQueue(vulnerabilityClass));
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(content.get());
            JsonNode vulnerabilities = root == null ? null : root.get("vulnerabilities");
            if (vulnerabilities == null || !vulnerabilities.isArray()) {
                log.warn("Exploitation queue for {} has no 'vulnerabilities' array", vulnerabilityClass);
                return Optional.empty();
            }
            var items = new ArrayList<JsonNode>();
            vulnerabilities.forEach(items::add);
            return Optional.of(items);
        } catch (JsonProcessingException e) {
            log.warn("Exploitation queue for {} is not valid JSON: {}", vulnerabilityClass, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
