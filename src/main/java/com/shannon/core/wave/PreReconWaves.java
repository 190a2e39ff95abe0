package com.shannon.core.wave;

import com.shannon.config.ShannonProperties;
import com.shannon.core.model.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Builds the two pre-reconnaissance waves. Members whose tool is missing, or every tool when
 * pipeline testing, are declared {@link WaveOperation#unavailable()} so they show up as skipped.
 */
@Component
public class PreReconWaves {

    private static final Logger log = LoggerFactory.getLogger(PreReconWaves.class);

    public static final String INITIAL_WAVE = "initial-footprinting";
    public static final String ADDITIONAL_WAVE = "additional-scanning";
    public static final String CODE_ANALYSIS = "code-analysis";

    static final String SCHEMAS_DIR = "outputs/schemas";

    private final ToolRunner toolRunner;
    private final ToolAvailabilityChecker availability;
    private final Duration timeout;

    @Autowired
    public PreReconWaves(ToolRunner toolRunner, ToolAvailabilityChecker availability, ShannonProperties properties) {
        this(toolRunner, availability, Duration.ofSeconds(properties.getToolTimeoutSeconds()));
    }

    PreReconWaves(ToolRunner toolRunner, ToolAvailabilityChecker availability, Duration timeout) {
        this.toolRunner = toolRunner;
        this.availability = availability;
        this.timeout = timeout;
    }

    /**
     * nmap, subfinder, whatweb, then naabu when installed, then the code-analysis agent unless blackbox.
     */
    public Map<String, WaveOperation> initialWave(String target, Path workspace, RunOptions options,
                                                  WaveOperation codeAnalysis) {
        String host = ScanCommands.hostOf(target);
        var wave = new LinkedHashMap<String, WaveOperation>();
        wave.put("nmap", tool("nmap", ScanCommands.nmap(host), workspace, options));
        wave.put("subfinder", tool("subfinder", ScanCommands.subfinder(host), workspace, options));
        wave.put("whatweb", tool("whatweb", ScanCommands.whatweb(target), workspace, options));
        wave.put("naabu", tool("naabu", ScanCommands.naabu(host), workspace, options));
        if (!options.blackbox()) {
            wave.put(CODE_ANALYSIS, codeAnalysis);
        }
        return wave;
    }

    public Map<String, WaveOperation> additionalWave(String target, Path workspace, RunOptions options) {
        var wave = new LinkedHashMap<String, WaveOperation>();
        wave.put("schemathesis", isUsable("schemathesis", options)
                ? () -> runSchemathesis(target, workspace)
                : WaveOperation.unavailable());
        wave.put("httpx", tool("httpx", ScanCommands.httpx(target), workspace, options));
        wave.put("nuclei", isUsable("nuclei", options)
                ? () -> emptyAs(run(ScanCommands.nuclei(target), workspace), "No findings")
                : WaveOperation.unavailable());
        wave.put("sqlmap", tool("sqlmap", ScanCommands.sqlmap(target), workspace, options));
        return wave;
    }

    private WaveOperation tool(String name, List<String> command, Path workspace, RunOptions options) {
        if (!isUsable(name, options)) {
            return WaveOperation.unavailable();
        }
        return () -> run(command, workspace);
    }

    private boolean isUsable(String tool, RunOptions options) {
        return !options.pipelineTesting() && availability.isAvailable(tool);
    }

    private ToolRunResult run(List<String> command, Path workspace) throws IOException, InterruptedException {
        return toolRunner.run(command, workspace, timeout);
    }

    private ToolRunResult runSchemathesis(String target, Path workspace) throws IOException, InterruptedException {
        Path schemasDir = workspace.resolve(SCHEMAS_DIR);
        if (!Files.isDirectory(schemasDir)) {
            return ToolRunResult.ok("Schemas directory not found");
        }
        List<Path> schemas;
        try (Stream<Path> files = Files.list(schemasDir)) {
            schemas = files.filter(PreReconWaves::isSchemaFile).sorted().toList();
        }
        if (schemas.isEmpty()) {
            return ToolRunResult.ok("No API schemas found");
        }

        var sections = new ArrayList<String>();
        for (Path schema : schemas) {
            log.info("Running schemathesis against {}", schema.getFileName());
            ToolRunResult result = run(ScanCommands.schemathesis(schema, target), workspace);
            String body = result.succeeded() ? result.stdout() : result.failureSummary();
            sections.add("Schema: " + schema.getFileName() + "\n" + body);
        }
        return ToolRunResult.ok(String.join("\n\n", sections));
    }

    private static boolean isSchemaFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static ToolRunResult emptyAs(ToolRunResult result, String placeholder) {
        if (result.succeeded() && (result.stdout() == null || result.stdout().isBlank())) {
            return new ToolRunResult(0, placeholder, result.stderr(), false);
        }
        return result;
    }
}
