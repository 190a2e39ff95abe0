package com.shannon.core.checkpoint;

import com.shannon.core.model.CommitRef;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Checkpoint and rollback against a real {@code git} repository in a temporary directory.
 */
class CheckpointStoreGitTest {

    @TempDir
    Path workspace;

    private CheckpointStore store;

    @BeforeAll
    static void requireGit() {
        boolean available;
        try {
            available = new ProcessBuilder("git", "--version").start().waitFor() == 0;
        } catch (IOException e) {
            available = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            available = false;
        }
        assumeTrue(available, "git is not installed");
    }

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(workspace.resolve("app.js"), "console.log('v1');\n");
        Files.writeString(workspace.resolve("README.md"), "readme\n");
        Files.writeString(workspace.resolve(".gitignore"), "*.log\nbuild/\n");
        store = new CheckpointStore(new GitVersionControl(), null);
        store.prepare(workspace);
    }

    @Test
    @DisplayName("tracked edits are reverted and new files and directories are removed")
    void restoresTrackedAndUntrackedState() throws IOException {
        store.checkpoint(workspace, "recon", 1);

        Files.writeString(workspace.resolve("app.js"), "console.log('agent');\n");
        Files.delete(workspace.resolve("README.md"));
        Files.writeString(workspace.resolve("notes.txt"), "scratch\n");
        Files.createDirectories(workspace.resolve("deliverables/tmp"));
        Files.writeString(workspace.resolve("deliverables/tmp/draft.md"), "draft\n");

        store.rollback(workspace, "recon", "validation failed");

        assertEquals("console.log('v1');\n", Files.readString(workspace.resolve("app.js")));
        assertEquals("readme\n", Files.readString(workspace.resolve("README.md")));
        assertFalse(Files.exists(workspace.resolve("notes.txt")));
        assertFalse(Files.exists(workspace.resolve("deliverables")));
    }

    @Test
    @DisplayName("ignored files created after the checkpoint are removed, earlier ones are kept")
    void removesIgnoredFilesCreatedAfterCheckpoint() throws IOException {
        Files.writeString(workspace.resolve("server.log"), "existing log\n");
        store.checkpoint(workspace, "recon", 1);

        Files.writeString(workspace.resolve("plain.txt"), "new\n");
        Files.writeString(workspace.resolve("agent.log"), "agent output\n");
        Files.createDirectories(workspace.resolve("build/classes"));
        Files.writeString(workspace.resolve("build/classes/Main.class"), "bytes");

        store.rollback(workspace, "recon", "agent crashed");

        assertFalse(Files.exists(workspace.resolve("plain.txt")));
        assertFalse(Files.exists(workspace.resolve("agent.log")));
        assertFalse(Files.exists(workspace.resolve("build")));
        assertEquals("existing log\n", Files.readString(workspace.resolve("server.log")));
    }

    @Test
    @DisplayName("new files inside an ignored directory that already existed are removed")
    void removesNewFilesInsideExistingIgnoredDirectory() throws IOException {
        Files.createDirectories(workspace.resolve("build"));
        Files.writeString(workspace.resolve("build/old.out"), "old");
        store.checkpoint(workspace, "recon", 1);

        Files.writeString(workspace.resolve("build/new.out"), "new");

        store.rollback(workspace, "recon", "retry");

        assertTrue(Files.exists(workspace.resolve("build/old.out")));
        assertFalse(Files.exists(workspace.resolve("build/new.out")));
    }

    @Test
    @DisplayName("rolling back twice leaves the workspace as the first rollback did")
    void rollbackIsIdempotent() throws IOException {
        store.checkpoint(workspace, "recon", 1);
        Files.writeString(workspace.resolve("app.js"), "changed\n");
        Files.writeString(workspace.resolve("extra.log"), "log\n");

        store.rollback(workspace, "recon", "first");
        List<String> afterFirst = listing();
        store.rollback(workspace, "recon", "second");

        assertEquals(afterFirst, listing());
        assertEquals("console.log('v1');\n", Files.readString(workspace.resolve("app.js")));
    }

    @Test
    @DisplayName("a committed success becomes the new rollback target")
    void successIsKept() throws IOException {
        store.checkpoint(workspace, "recon", 1);
        Files.writeString(workspace.resolve("recon_deliverable.md"), "# Recon\n");
        CommitRef success = store.commitSuccess(workspace, "recon");

        Files.writeString(workspace.resolve("later.txt"), "later\n");
        store.rollback(workspace, "recon", "later failure");

        assertEquals("# Recon\n", Files.readString(workspace.resolve("recon_deliverable.md")));
        assertFalse(Files.exists(workspace.resolve("later.txt")));
        assertNotNull(success.value());
    }

    @Test
    void restoreToEarlierCheckpointDropsLaterWork() throws IOException {
        CommitRef first = store.commitSuccess(workspace, "pre-recon");
        Files.writeString(workspace.resolve("recon_deliverable.md"), "# Recon\n");
        Files.writeString(workspace.resolve("recon.log"), "log\n");
        store.commitSuccess(workspace, "recon");

        store.restoreTo(workspace, first);

        assertFalse(Files.exists(workspace.resolve("recon_deliverable.md")));
        assertFalse(Files.exists(workspace.resolve("recon.log")));
    }

    private List<String> listing() throws IOException {
        try (Stream<Path> files = Files.walk(workspace)) {
            return files.filter(p -> !p.startsWith(workspace.resolve(".git")))
                    .map(p -> workspace.relativize(p).toString())
                    .sorted()
                    .toList();
        }
    }
}
