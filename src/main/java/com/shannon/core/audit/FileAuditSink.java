package com.shannon.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shannon.config.ShannonProperties;
import com.shannon.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each attempt as JSON Lines under {@code <root>/<session>/agents/<agent>/attempt-<n>.jsonl},
 * with the exact prompt saved next to it. Every line is forced to disk before {@link #append} returns.
 * <p>
 * A resumed session that reruns an agent starts its attempt numbers from 1 again; those runs are written to
 * {@code attempt-<n>.run-<k>} so earlier logs and prompts are never overwritten or appended to.
 */
@Component
public class FileAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(FileAuditSink.class);

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileAuditSink(ShannonProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getAuditDir()), objectMapper);
    }

    FileAuditSink(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    public Path agentDirectory(String sessionId, String agentName) {
        return root.resolve(sessionId).resolve("agents").resolve(agentName);
    }

    @Override
    public AttemptHandle startAttempt(String sessionId, String agentName, int attemptNumber, String promptSnapshot) {
        Path dir = agentDirectory(sessionId, agentName);
        Path logFile;
        try {
            Files.createDirectories(dir);
            logFile = claimLogFile(dir, attemptNumber, promptSnapshot == null ? "" : promptSnapshot);
        } catch (IOException e) {
            throw new StorageException("Cannot create audit log for " + agentName + " in " + dir, e);
        }

        var handle = new AttemptHandle(sessionId, agentName, attemptNumber, logFile, Instant.now());
        append(handle, AuditEvent.of(AuditEventKind.ATTEMPT_STARTED, Map.of(
                "agent", agentName,
                "attempt", attemptNumber,
                "promptLength", promptSnapshot == null ? 0 : promptSnapshot.length())));
        log.debug("Audit log for {} attempt {} at {}", agentName, attemptNumber, logFile);
        return handle;
    }

    /**
     * Creates the prompt snapshot and an empty log under the first unused name for this attempt number.
     * Creation is exclusive, so two runs can never share a file.
     */
    private static Path claimLogFile(Path dir, int attemptNumber, String prompt) throws IOException {
        for (int run = 1; ; run++) {
            String base = "attempt-" + attemptNumber + (run == 1 ? "" : ".run-" + run);
            Path promptFile = dir.resolve(base + ".prompt.md");
            Path logFile = dir.resolve(base + ".jsonl");
            if (Files.exists(logFile)) {
                continue;
            }
            try {
                Files.writeString(promptFile, prompt, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                continue;
            }
            try {
                Files.createFile(logFile);
            } catch (FileAlreadyExistsException e) {
                Files.deleteIfExists(promptFile);
                continue;
            }
            return logFile;
        }
    }

    @Override
    public synchronized void append(AttemptHandle handle, AuditEvent event) {
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialise audit event " + event.kind(), e);
        }
        try (var channel = FileChannel.open(handle.logFile(), StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            var buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException e) {
            throw new StorageException("Cannot append to audit log " + handle.logFile(), e);
        }
    }

    @Override
    public void endAttempt(AttemptHandle handle, String outcome, Map<String, Object> details) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("outcome", outcome);
        payload.put("elapsedMs", Duration.between(handle.startedAt(), Instant.now()).toMillis());
        if (details != null) {
            payload.putAll(details);
        }
        append(handle, AuditEvent.of(AuditEventKind.ATTEMPT_ENDED, payload));
    }
}
