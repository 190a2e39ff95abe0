package com.shannon.core.wave;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ToolRunner} on {@link ProcessBuilder}. Output goes to temporary files so a chatty tool can never
 * block on a full pipe; a process that outlives its timeout is killed.
 */
@Component
public class ProcessToolRunner implements ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolRunner.class);

    @Override
    public ToolRunResult run(List<String> command, Path workDir, Duration timeout)
            throws IOException, InterruptedException {
        Path stdoutFile = Files.createTempFile("shannon-tool-", ".out");
        Path stderrFile = Files.createTempFile("shannon-tool-", ".err");
        try {
            var builder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            if (workDir != null) {
                builder.directory(workDir.toFile());
            }
            log.debug("Running: {}", String.join(" ", command));
            Process process = builder.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("{} exceeded {}s, killing it", command.get(0), timeout.toSeconds());
                process.destroyForcibly();
                process.waitFor(10, TimeUnit.SECONDS);
            }
            String stdout = readLeniently(stdoutFile);
            String stderr = readLeniently(stderrFile);
            return new ToolRunResult(finished ? process.exitValue() : -1, stdout, stderr, !finished);
        } finally {
            Files.deleteIfExists(stdoutFile);
            Files.deleteIfExists(stderrFile);
        }
    }

    /** Scanner banners often carry raw Latin-1 bytes; malformed sequences become U+FFFD instead of failing. */
    private static String readLeniently(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}
