package com.shannon.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an attempt log back. A trailing line without a newline is a write torn by a crash and is skipped;
 * the file itself is never modified.
 */
@Component
public class AuditLogReader {

    private static final Logger log = LoggerFactory.getLogger(AuditLogReader.class);

    private final ObjectMapper objectMapper;

    public AuditLogReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<AuditEvent> replay(Path logFile) {
        String content;
        try {
            content = Files.readString(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read audit log " + logFile, e);
        }

        String[] lines = content.split("\n", -1);
        // the element after the last newline is either "" or a torn write
        int complete = lines.length - 1;
        if (!lines[complete].isEmpty()) {
            log.warn("Ignoring incomplete trailing line in {}", logFile);
        }

        var events = new ArrayList<AuditEvent>();
        for (int i = 0; i < complete; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            try {
                events.add(objectMapper.readValue(lines[i], AuditEvent.class));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt audit line " + (i + 1) + " in " + logFile, e);
            }
        }
        return events;
    }
}
