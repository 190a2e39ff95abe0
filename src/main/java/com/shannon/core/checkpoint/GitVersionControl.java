package com.shannon.core.checkpoint;

import com.shannon.core.error.StorageException;
import com.shannon.core.model.CommitRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link VersionControl} backed by the local {@code git} CLI.
 * <p>
 * Snapshots are plain commits on the current branch; restore is {@code reset --hard} followed by
 * {@code clean -fd}. Files matched by the workspace's ignore rules never enter a commit, so each snapshot also
 * records which ignored files existed at that point (under {@code .git/shannon/ignored/}). Restore deletes the
 * ignored files that are not in that record and keeps the ones that are.
 */
@Component
public class GitVersionControl implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitVersionControl.class);

    private static final String AUTHOR_NAME = "Shannon";
    private static final String AUTHOR_EMAIL = "shannon@localhost";
    private static final String NUL = "\0";

    @Override
    public void ensureRepository(Path workspace) {
        if (Files.isDirectory(workspace.resolve(".git"))) {
            return;
        }
        log.info("Initialising git repository in {}", workspace);
        require(runGit(workspace, "init"), "init", workspace);
        require(runGit(workspace, identity("commit", "--allow-empty", "-m", "Initial checkpoint")),
                "initial commit", workspace);
        recordIgnored(workspace, head(workspace));
    }

    @Override
    public CommitRef snapshot(Path workspace, String message) {
        require(runGit(workspace, "add", "-A"), "add", workspace);
        require(runGit(workspace, identity("commit", "--allow-empty", "--no-verify", "-m", message)),
                "commit", workspace);
        CommitRef ref = head(workspace);
        recordIgnored(workspace, ref);
        return ref;
    }

    @Override
    public void restore(Path workspace, CommitRef ref) {
        require(runGit(workspace, "reset", "--hard", ref.value()), "reset", workspace);
        require(runGit(workspace, "clean", "-fd"), "clean", workspace);
        removeIgnoredCreatedSince(workspace, ref);
    }

    @Override
    public CommitRef head(Path workspace) {
        String sha = runGitOutput(workspace, "rev-parse", "HEAD").trim();
        if (sha.isEmpty()) {
            throw new StorageException("Could not resolve HEAD in " + workspace);
        }
        return new CommitRef(sha);
    }

    private void recordIgnored(Path workspace, CommitRef ref) {
        Path gitDir = workspace.resolve(".git");
        if (!Files.isDirectory(gitDir)) {
            return;
        }
        Path index = ignoredIndex(gitDir, ref);
        try {
            Files.createDirectories(index.getParent());
            Files.writeString(index, String.join(NUL, ignoredPaths(workspace)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Could not record ignored files for " + ref.shortValue() + " in " + workspace, e);
        }
    }

    private void removeIgnoredCreatedSince(Path workspace, CommitRef ref) {
        Path index = ignoredIndex(workspace.resolve(".git"), ref);
        if (!Files.isRegularFile(index)) {
            log.debug("No ignored-file record for {}, leaving ignored files in place", ref.shortValue());
            return;
        }
        Path root = workspace.toAbsolutePath().normalize();
        try {
            Set<String> kept = split(Files.readString(index, StandardCharsets.UTF_8));
            Set<Path> keptDirs = new HashSet<>();
            for (String path : kept) {
                for (Path dir = root.resolve(path).getParent(); dir != null && dir.startsWith(root);
                     dir = dir.getParent()) {
                    keptDirs.add(dir);
                }
            }
            int removed = 0;
            for (String path : ignoredPaths(workspace)) {
                Path file = root.resolve(path).normalize();
                if (kept.contains(path) || !file.startsWith(root)) {
                    continue;
                }
                Files.deleteIfExists(file);
                removed++;
                for (Path dir = file.getParent(); dir != null && !dir.equals(root) && !keptDirs.contains(dir)
                        && isEmptyDirectory(dir); dir = dir.getParent()) {
                    Files.delete(dir);
                }
            }
            if (removed > 0) {
                log.info("Removed {} ignored file(s) created after {}", removed, ref.shortValue());
            }
        } catch (IOException e) {
            throw new StorageException("Could not remove ignored files created after " + ref.shortValue()
                    + " in " + workspace, e);
        }
    }

    private List<String> ignoredPaths(Path workspace) {
        return new ArrayList<>(split(runGitOutput(workspace,
                "ls-files", "-z", "--others", "--ignored", "--exclude-standard")));
    }

    private static Path ignoredIndex(Path gitDir, CommitRef ref) {
        return gitDir.resolve("shannon").resolve("ignored").resolve(ref.value());
    }

    private static Set<String> split(String nulSeparated) {
        var paths = new LinkedHashSet<String>();
        for (String path : nulSeparated.split(NUL)) {
            if (!path.isEmpty()) {
                paths.add(path);
            }
        }
        return paths;
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    private static String[] identity(String... args) {
        var full = new ArrayList<String>();
        full.add("-c");
        full.add("user.name=" + AUTHOR_NAME);
        full.add("-c");
        full.add("user.email=" + AUTHOR_EMAIL);
        full.addAll(List.of(args));
        return full.toArray(String[]::new);
    }

    private static void require(int exitCode, String operation, Path workspace) {
        if (exitCode != 0) {
            throw new StorageException("git " + operation + " failed in " + workspace + " (exit " + exitCode + ")");
        }
    }

    int runGit(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", line);
                }
            }
            return process.waitFor();
        } catch (IOException e) {
            throw new StorageException("git " + args[0] + " could not be started in " + workDir, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while running git " + args[0], e);
        }
    }

    String runGitOutput(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running (capture): {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new StorageException("git " + args[0] + " exited with code " + exitCode + " in " + workDir);
            }
            return output;
        } catch (IOException e) {
            throw new StorageException("git " + args[0] + " could not be started in " + workDir, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while running git " + args[0], e);
        }
    }

    private static List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }
}
