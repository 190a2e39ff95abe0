package com.shannon.dispatch.cli;

import com.shannon.config.ShannonProperties;
import com.shannon.core.error.ClassifiedException;
import com.shannon.core.error.PersistenceException;
import com.shannon.core.events.EventBus;
import com.shannon.core.model.RunOptions;
import com.shannon.core.model.Session;
import com.shannon.core.pipeline.PipelineRunner;
import com.shannon.core.retry.CancellationToken;
import com.shannon.core.session.SessionStateMachine;
import com.shannon.core.wave.ToolAvailabilityChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: shannon run &lt;web-url&gt; &lt;repo-path&gt;
 * <p>
 * Runs the pipeline, resuming the unfinished session for the same target and repository when there is one.
 * SIGINT/SIGTERM cancel the run; the in-flight attempt is rolled back before the JVM exits.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run or resume the pipeline")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_PERSISTENCE = 3;
    static final int EXIT_CANCELLED = 130;

    private static final long SHUTDOWN_GRACE_SECONDS = 120;

    @Parameters(index = "0", description = "Target web application URL")
    private String webUrl;

    @Parameters(index = "1", description = "Path to the target's source repository")
    private Path repoPath;

    @Option(names = "--blackbox", description = "No source code access; skip code analysis")
    private boolean blackbox;

    @Option(names = "--pipeline-testing", description = "Minimal prompts and no external tools")
    private boolean pipelineTesting;

    @Option(names = "--relax-validation", description = "Accept recon deliverables unchecked in text-only mode")
    private boolean relaxValidation;

    @Option(names = "--skip-mcp-phases", description = "Stop after pre-reconnaissance")
    private boolean skipMcpPhases;

    @Option(names = "--fresh", description = "Start a new session instead of resuming")
    private boolean fresh;

    private final SessionStateMachine stateMachine;
    private final PipelineRunner pipelineRunner;
    private final EventBus eventBus;
    private final ToolAvailabilityChecker toolChecker;
    private final ShannonProperties properties;
    private final CancellationToken cancellationToken;

    public RunCommand(SessionStateMachine stateMachine, PipelineRunner pipelineRunner, EventBus eventBus,
                      ToolAvailabilityChecker toolChecker, ShannonProperties properties,
                      CancellationToken cancellationToken) {
        this.stateMachine = stateMachine;
        this.pipelineRunner = pipelineRunner;
        this.eventBus = eventBus;
        this.toolChecker = toolChecker;
        this.properties = properties;
        this.cancellationToken = cancellationToken;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (!isHttpUrl(webUrl)) {
            ConsoleOutput.error("Target must be an http(s) URL: " + webUrl);
            return EXIT_USAGE;
        }
        if (!Files.isDirectory(repoPath)) {
            ConsoleOutput.error("Repository path is not a directory: " + repoPath);
            return EXIT_USAGE;
        }

        RunOptions options = new RunOptions(blackbox, pipelineTesting, relaxValidation,
                properties.getLlm().isTextOnly(), skipMcpPhases);

        if (!pipelineTesting) {
            for (String tool : toolChecker.missingTools()) {
                ConsoleOutput.warn(tool + " not found, it will be skipped (install: "
                        + ToolAvailabilityChecker.installHint(tool) + ")");
            }
        }

        Session session;
        try {
            session = stateMachine.openSession(webUrl, repoPath, !fresh);
        } catch (PersistenceException e) {
            ConsoleOutput.error("Cannot open session: " + e.getMessage());
            return EXIT_PERSISTENCE;
        }
        ConsoleOutput.info("Session " + session.id() + " (" + session.completedAgents().size()
                + " agent(s) already completed)");

        var subscription = eventBus.subscribe(session.id(), ConsoleOutput::event);
        var finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            cancellationToken.cancel();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shannon-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            Session result = pipelineRunner.run(session, options, cancellationToken);
            ConsoleOutput.sessionSummary(result);
            ConsoleOutput.success("Deliverables in " + repoPath.resolve("deliverables").toAbsolutePath());
            return 0;
        } catch (ClassifiedException e) {
            ConsoleOutput.failure(e);
            ConsoleOutput.sessionSummary(stateMachine.refresh(session));
            return e.classification() == ClassifiedException.Classification.CANCELLED ? EXIT_CANCELLED : EXIT_FAILED;
        } catch (PersistenceException e) {
            ConsoleOutput.error("Session progress could not be saved: " + e.getMessage());
            ConsoleOutput.error("Completed work is still in the workspace; check " + repoPath + " before rerunning");
            return EXIT_PERSISTENCE;
        } finally {
            finished.countDown();
            subscription.unsubscribe();
            removeShutdownHook(shutdownHook);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // the JVM is already shutting down and the hook is running
            log.debug("Shutdown in progress, leaving hook registered");
        }
    }

    static boolean isHttpUrl(String value) {
        try {
            URI uri = URI.create(value);
            return ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme())) && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
