package com.shannon.core.checkpoint;

import com.shannon.core.error.StorageException;
import com.shannon.core.model.CommitRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitVersionControl}.
 *
 * <p>Uses a test subclass to intercept git commands, so command construction can be verified
 * without a real repository.
 */
class GitVersionControlTest {

    private TestableGitVersionControl git;
    private final Path workspace = Path.of("/tmp/target-app");

    @BeforeEach
    void setUp() {
        git = new TestableGitVersionControl();
    }

    // --- snapshot ---

    @Test
    void snapshotStagesEverythingAndCommitsEvenWhenNothingChanged() {
        git.setGitOutput("0123456789abcdef0123456789abcdef01234567\n");

        CommitRef ref = git.snapshot(workspace, "Checkpoint: recon (attempt 1)");

        assertEquals("0123456789abcdef0123456789abcdef01234567", ref.value());
        var commands = git.getExecutedCommands();
        assertEquals(List.of("add", "-A"), commands.get(0));
        assertTrue(commands.get(1).contains("commit"));
        assertTrue(commands.get(1).contains("--allow-empty"));
        assertTrue(commands.get(1).contains("Checkpoint: recon (attempt 1)"));
        assertTrue(commands.get(1).contains("user.name=Shannon"));
        assertEquals(List.of("rev-parse", "HEAD"), commands.get(2));
    }

    @Test
    void snapshotThrowsWhenCommitFails() {
        git.failOn("commit", 128);

        assertThrows(StorageException.class, () -> git.snapshot(workspace, "Checkpoint: recon (attempt 1)"));
    }

    @Test
    void headRejectsEmptyOutput() {
        git.setGitOutput("   ");

        assertThrows(StorageException.class, () -> git.head(workspace));
    }

    // --- restore ---

    @Test
    void restoreResetsHardThenRemovesUntrackedFiles() {
        git.restore(workspace, new CommitRef("abc1234"));

        var commands = git.getExecutedCommands();
        assertEquals(2, commands.size());
        assertEquals(List.of("reset", "--hard", "abc1234"), commands.get(0));
        assertEquals(List.of("clean", "-fd"), commands.get(1));
    }

    @Test
    void restoreStopsWhenResetFails() {
        git.failOn("reset", 1);

        assertThrows(StorageException.class, () -> git.restore(workspace, new CommitRef("abc1234")));
        assertEquals(1, git.getExecutedCommands().size());
    }

    // --- ensureRepository ---

    @Test
    void ensureRepositoryInitialisesMissingRepository(@TempDir Path dir) {
        git.ensureRepository(dir);

        var commands = git.getExecutedCommands();
        assertEquals(List.of("init"), commands.get(0));
        assertTrue(commands.get(1).contains("--allow-empty"));
    }

    @Test
    void ensureRepositoryLeavesExistingRepositoryAlone(@TempDir Path dir) throws Exception {
        Files.createDirectory(dir.resolve(".git"));

        git.ensureRepository(dir);

        assertTrue(git.getExecutedCommands().isEmpty());
    }

    /**
     * Records git invocations instead of running them.
     */
    static class TestableGitVersionControl extends GitVersionControl {
        private final List<List<String>> executedCommands = new ArrayList<>();
        private String gitOutput = "abc1234";
        private String failingCommand;
        private int failingExitCode;

        void setGitOutput(String output) {
            this.gitOutput = output;
        }

        void failOn(String command, int exitCode) {
            this.failingCommand = command;
            this.failingExitCode = exitCode;
        }

        List<List<String>> getExecutedCommands() {
            return executedCommands;
        }

        @Override
        int runGit(Path workDir, String... args) {
            executedCommands.add(List.of(args));
            return failingCommand != null && List.of(args).contains(failingCommand) ? failingExitCode : 0;
        }

        @Override
        String runGitOutput(Path workDir, String... args) {
            executedCommands.add(List.of(args));
            return gitOutput;
        }
    }
}
