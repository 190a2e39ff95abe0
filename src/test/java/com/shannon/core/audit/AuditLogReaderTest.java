package com.shannon.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogReaderTest {

    @TempDir
    Path dir;

    private final AuditLogReader reader = new AuditLogReader(new ObjectMapper().registerModule(new JavaTimeModule()));

    private static final String STARTED =
            "{\"kind\":\"ATTEMPT_STARTED\",\"payload\":{\"attempt\":1},\"timestamp\":\"2026-01-05T10:00:00Z\"}";
    private static final String TOOL =
            "{\"kind\":\"TOOL_START\",\"payload\":{\"tool\":\"Bash\"},\"timestamp\":\"2026-01-05T10:00:01Z\"}";

    @Test
    void skipsTornTrailingLine() throws Exception {
        Path log = dir.resolve("attempt-1.jsonl");
        Files.writeString(log, STARTED + "\n" + TOOL + "\n" + "{\"kind\":\"LLM_RESP");

        var events = reader.replay(log);

        assertEquals(2, events.size());
        assertEquals(AuditEventKind.TOOL_START, events.get(1).kind());
        assertEquals("Bash", events.get(1).payload().get("tool"));
    }

    @Test
    void leavesTornFileUntouched() throws Exception {
        Path log = dir.resolve("attempt-1.jsonl");
        String content = STARTED + "\n{\"kind\":";
        Files.writeString(log, content);

        reader.replay(log);

        assertEquals(content, Files.readString(log));
    }

    @Test
    void rejectsCorruptCompleteLine() throws Exception {
        Path log = dir.resolve("attempt-1.jsonl");
        Files.writeString(log, STARTED + "\nnot json\n" + TOOL + "\n");

        assertThrows(IllegalStateException.class, () -> reader.replay(log));
    }

    @Test
    void emptyFileHasNoEvents() throws Exception {
        Path log = dir.resolve("attempt-1.jsonl");
        Files.writeString(log, "");

        assertTrue(reader.replay(log).isEmpty());
    }
}
