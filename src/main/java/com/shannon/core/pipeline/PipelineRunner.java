package com.shannon.core.pipeline;

import com.shannon.config.ShannonProperties;
import com.shannon.core.checkpoint.CheckpointStore;
import com.shannon.core.error.ClassifiedException;
import com.shannon.core.error.ClassifiedException.Classification;
import com.shannon.core.error.PersistenceException;
import com.shannon.core.events.EventBus;
import com.shannon.core.events.ShannonEvent;
import com.shannon.core.logging.MdcContext;
import com.shannon.core.metrics.ShannonMetrics;
import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.Phase;
import com.shannon.core.model.RunOptions;
import com.shannon.core.model.Session;
import com.shannon.core.retry.AgentRunResult;
import com.shannon.core.retry.CancellationToken;
import com.shannon.core.retry.RetryOrchestrator;
import com.shannon.core.session.SessionStateMachine;
import com.shannon.core.validation.DeliverableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a session through the five phases, starting at the first phase with unfinished agents.
 * <p>
 * Parallel phases run every pending agent to completion even when a sibling fails; failed agents are recorded
 * and the phase then fails with the first failure in catalog order.
 */
@Service
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final SessionStateMachine stateMachine;
    private final RetryOrchestrator retryOrchestrator;
    private final PreReconPhase preReconPhase;
    private final ReportAssembler reportAssembler;
    private final PromptLoader promptLoader;
    private final DeliverableStore deliverableStore;
    private final CheckpointStore checkpointStore;
    private final EventBus eventBus;
    private final ShannonMetrics metrics;
    private final int agentMaxParallel;

    @Autowired
    public PipelineRunner(SessionStateMachine stateMachine, RetryOrchestrator retryOrchestrator,
                          PreReconPhase preReconPhase, ReportAssembler reportAssembler, PromptLoader promptLoader,
                          DeliverableStore deliverableStore, CheckpointStore checkpointStore, EventBus eventBus,
                          @Autowired(required = false) ShannonMetrics metrics, ShannonProperties properties) {
        this(stateMachine, retryOrchestrator, preReconPhase, reportAssembler, promptLoader, deliverableStore,
                checkpointStore, eventBus, metrics, properties.getAgentMaxParallel());
    }

    PipelineRunner(SessionStateMachine stateMachine, RetryOrchestrator retryOrchestrator,
                   PreReconPhase preReconPhase, ReportAssembler reportAssembler, PromptLoader promptLoader,
                   DeliverableStore deliverableStore, CheckpointStore checkpointStore, EventBus eventBus,
                   ShannonMetrics metrics, int agentMaxParallel) {
        this.stateMachine = stateMachine;
        this.retryOrchestrator = retryOrchestrator;
        this.preReconPhase = preReconPhase;
        this.reportAssembler = reportAssembler;
        this.promptLoader = promptLoader;
        this.deliverableStore = deliverableStore;
        this.checkpointStore = checkpointStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.agentMaxParallel = Math.max(1, agentMaxParallel);
    }

    /**
     * Runs every remaining phase of the session.
     *
     * @return the session as last persisted
     * @throws ClassifiedException when an agent fails terminally or the run is cancelled
     */
    public Session run(Session session, RunOptions options, CancellationToken token) {
        MdcContext.setSession(session.id());
        try {
            checkpointStore.prepare(Path.of(session.workspaceRef()));

            Optional<Phase> start = stateMachine.startPhase(session);
            if (start.isEmpty()) {
                log.info("Session {} has no remaining agents", session.id());
                return stateMachine.complete(session);
            }
            log.info("Session {} starting at phase {} ({})", session.id(), start.get().number(),
                    start.get().label());

            Session current = session;
            for (Phase phase : Phase.values()) {
                if (phase.number() < start.get().number()) {
                    continue;
                }
                if (token.isCancelled()) {
                    throw new ClassifiedException(Classification.CANCELLED, null,
                            Path.of(session.workspaceRef()), 0, 0.0, "Run cancelled before " + phase.label(), null);
                }
                current = runPhase(phase, current, options, token);

                if (phase == Phase.PRE_RECON && options.skipMcpPhases()) {
                    log.info("Stopping after pre-reconnaissance: remaining phases need browser tooling");
                    return current;
                }
            }

            Session completed = stateMachine.complete(current);
            eventBus.publish(ShannonEvent.of("session.completed", completed.id(), null, Map.of(
                    "durationMs", completed.totalDurationMs(),
                    "costUsd", completed.totalCostUsd())));
            if (metrics != null) {
                metrics.recordSessionResult("completed");
            }
            return completed;
        } catch (ClassifiedException e) {
            if (metrics != null) {
                metrics.recordSessionResult(e.classification().name().toLowerCase());
            }
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private Session runPhase(Phase phase, Session session, RunOptions options, CancellationToken token) {
        List<AgentDefinition> pending = stateMachine.pendingAgents(session, phase);
        if (pending.isEmpty()) {
            return session;
        }
        log.info("Phase {} ({}): {} agent(s) pending", phase.number(), phase.label(),
                pending.stream().map(AgentDefinition::name).toList());
        eventBus.publish(ShannonEvent.of("phase.started", session.id(), null, Map.of(
                "phase", phase.label(), "agents", pending.size())));

        Session result = switch (phase) {
            case PRE_RECON -> runPreRecon(session, options, token);
            case REPORTING -> {
                int sections = reportAssembler.assemble(Path.of(session.workspaceRef()));
                log.info("Assembled final report draft from {} evidence file(s)", sections);
                yield runSequential(pending, session, options, token);
            }
            default -> phase.isParallel()
                    ? runParallel(pending, session, options, token)
                    : runSequential(pending, session, options, token);
        };

        eventBus.publish(ShannonEvent.of("phase.completed", session.id(), null, Map.of("phase", phase.label())));
        return result;
    }

    private Session runPreRecon(Session session, RunOptions options, CancellationToken token) {
        try {
            Optional<AgentRunResult> codeRun = preReconPhase.run(session, options, token);
            return stateMachine.updateProgress(session, AgentCatalog.PRE_RECON,
                    codeRun.map(AgentRunResult::checkpoint).orElse(null),
                    codeRun.map(AgentRunResult::totalDurationMs).orElse(0L),
                    codeRun.map(AgentRunResult::totalCostUsd).orElse(0.0));
        } catch (ClassifiedException e) {
            stateMachine.markFailed(session, AgentCatalog.PRE_RECON, 0L, e.totalCostUsd());
            throw e;
        }
    }

    private Session runSequential(List<AgentDefinition> agents, Session session, RunOptions options,
                                  CancellationToken token) {
        Session current = session;
        for (AgentDefinition agent : agents) {
            current = runAgent(agent, current, options, token);
        }
        return current;
    }

    private Session runParallel(List<AgentDefinition> agents, Session session, RunOptions options,
                                CancellationToken token) {
        var threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(agents.size(), agentMaxParallel), r -> {
            Thread t = new Thread(r, "agent-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        var futures = new LinkedHashMap<String, CompletableFuture<Session>>();
        try {
            for (AgentDefinition agent : agents) {
                futures.put(agent.name(), CompletableFuture.supplyAsync(() -> {
                    MdcContext.setSession(session.id());
                    try {
                        return runAgent(agent, session, options, token);
                    } finally {
                        MdcContext.clear();
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                    .exceptionally(e -> null)
                    .join();
        } finally {
            executor.shutdown();
        }

        var failures = new ArrayList<RuntimeException>();
        for (CompletableFuture<Session> future : futures.values()) {
            try {
                future.join();
            } catch (CompletionException e) {
                failures.add(unwrap(e));
            }
        }
        if (!failures.isEmpty()) {
            log.error("{} of {} parallel agents failed", failures.size(), agents.size());
            throw failures.get(0);
        }
        return stateMachine.refresh(session);
    }

    private Session runAgent(AgentDefinition agent, Session session, RunOptions options, CancellationToken token) {
        Path workspace = Path.of(session.workspaceRef());

        if (agent.isExploit() && !hasQueuedVulnerabilities(agent, workspace)) {
            log.info("Skipping {}: no vulnerabilities queued for exploitation", agent.name());
            eventBus.publish(ShannonEvent.of("agent.skipped", session.id(), agent.name(),
                    Map.of("reason", "empty exploitation queue")));
            return stateMachine.updateProgress(session, agent.name(), null);
        }

        try {
            String prompt = promptLoader.load(agent, session.targetRef(), workspace, options);
            AgentRunResult result = retryOrchestrator.runWithRetry(agent, prompt, workspace, session.id(),
                    options, token);
            return stateMachine.updateProgress(session, agent.name(), result.checkpoint(),
                    result.totalDurationMs(), result.totalCostUsd());
        } catch (ClassifiedException e) {
            stateMachine.markFailed(session, agent.name(), 0L, e.totalCostUsd());
            throw e;
        } catch (PersistenceException e) {
            // the agent's work is committed; only the progress record is missing
            log.error("{} finished but its progress could not be saved: {}", agent.name(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("{} could not be run: {}", agent.name(), e.getMessage());
            stateMachine.markFailed(session, agent.name(), 0L, 0.0);
            throw e;
        }
    }

    private boolean hasQueuedVulnerabilities(AgentDefinition agent, Path workspace) {
        return deliverableStore.readQueue(workspace, agent.vulnerabilityClass())
                .map(items -> !items.isEmpty())
                .orElse(false);
    }

    private static RuntimeException unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof RuntimeException runtime
                ? runtime
                : new IllegalStateException("Agent failed", cause);
    }
}
