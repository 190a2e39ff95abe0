package com.shannon.core.wave;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion or until the timeout expires.
 */
public interface ToolRunner {

    ToolRunResult run(List<String> command, Path workDir, Duration timeout) throws IOException, InterruptedException;
}
