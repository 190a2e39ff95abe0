package com.shannon.core.pipeline;

import com.shannon.core.checkpoint.CheckpointStore;
import com.shannon.core.error.ClassifiedException;
import com.shannon.core.error.ShannonException;
import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.RunOptions;
import com.shannon.core.model.Session;
import com.shannon.core.model.ToolScanResult;
import com.shannon.core.model.ToolStatus;
import com.shannon.core.retry.AgentRunResult;
import com.shannon.core.retry.CancellationToken;
import com.shannon.core.retry.RetryOrchestrator;
import com.shannon.core.wave.PreReconReportWriter;
import com.shannon.core.wave.PreReconWaves;
import com.shannon.core.wave.ToolRunResult;
import com.shannon.core.wave.WaveOperation;
import com.shannon.core.wave.WaveScheduler;
import com.shannon.core.validation.DeliverableStore;
import com.shannon.core.validation.Deliverables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Phase 1: the initial footprinting wave (scanners plus the code-analysis agent), the additional scanning
 * wave, then the stitched pre-reconnaissance report.
 */
@Component
public class PreReconPhase {

    private static final Logger log = LoggerFactory.getLogger(PreReconPhase.class);

    private final WaveScheduler waveScheduler;
    private final PreReconWaves waves;
    private final RetryOrchestrator retryOrchestrator;
    private final PromptLoader promptLoader;
    private final DeliverableStore deliverableStore;
    private final CheckpointStore checkpointStore;

    public PreReconPhase(WaveScheduler waveScheduler, PreReconWaves waves, RetryOrchestrator retryOrchestrator,
                         PromptLoader promptLoader, DeliverableStore deliverableStore,
                         CheckpointStore checkpointStore) {
        this.waveScheduler = waveScheduler;
        this.waves = waves;
        this.retryOrchestrator = retryOrchestrator;
        this.promptLoader = promptLoader;
        this.deliverableStore = deliverableStore;
        this.checkpointStore = checkpointStore;
    }

    /**
     * @return the code-analysis agent's run, empty in blackbox mode
     * @throws ClassifiedException when the code-analysis agent failed
     */
    public Optional<AgentRunResult> run(Session session, RunOptions options, CancellationToken token) {
        Path workspace = Path.of(session.workspaceRef());
        AgentDefinition agent = AgentCatalog.require(AgentCatalog.PRE_RECON);
        var codeRun = new AtomicReference<AgentRunResult>();

        WaveOperation codeAnalysis = () -> {
            String prompt = promptLoader.load(agent, session.targetRef(), workspace, options);
            AgentRunResult result = retryOrchestrator.runWithRetry(agent, prompt, workspace, session.id(),
                    options, token);
            codeRun.set(result);
            return ToolRunResult.ok(result.finalAttempt().payload());
        };

        Map<String, ToolScanResult> initial = waveScheduler.runWave(session.id(), PreReconWaves.INITIAL_WAVE,
                waves.initialWave(session.targetRef(), workspace, options, codeAnalysis));

        ToolScanResult analysis = initial.get(PreReconWaves.CODE_ANALYSIS);
        if (analysis != null && analysis.status() == ToolStatus.FAILED) {
            if (analysis.error() instanceof ClassifiedException classified) {
                throw classified;
            }
            throw new ShannonException("Code analysis failed: " + analysis.output(), analysis.error());
        }

        Map<String, ToolScanResult> additional = waveScheduler.runWave(session.id(), PreReconWaves.ADDITIONAL_WAVE,
                waves.additionalWave(session.targetRef(), workspace, options));

        String codeAnalysisReport = deliverableStore.read(workspace, Deliverables.CODE_ANALYSIS).orElse(null);
        deliverableStore.write(workspace, Deliverables.PRE_RECON,
                PreReconReportWriter.render(initial, additional, codeAnalysisReport));
        checkpointStore.commitSuccess(workspace, "pre-recon-report");
        log.info("Pre-reconnaissance report written to {}",
                deliverableStore.path(workspace, Deliverables.PRE_RECON));

        return Optional.ofNullable(codeRun.get());
    }
}
