package com.shannon.core.retry;

import com.shannon.config.ShannonProperties;
import com.shannon.core.audit.AttemptHandle;
import com.shannon.core.audit.AuditEvent;
import com.shannon.core.audit.AuditEventKind;
import com.shannon.core.audit.AuditSink;
import com.shannon.core.checkpoint.CheckpointStore;
import com.shannon.core.error.AgentExecutionException;
import com.shannon.core.error.ClassifiedException;
import com.shannon.core.error.ClassifiedException.Classification;
import com.shannon.core.error.ErrorCategory;
import com.shannon.core.error.ErrorClassifier;
import com.shannon.core.error.StorageException;
import com.shannon.core.events.EventBus;
import com.shannon.core.events.ShannonEvent;
import com.shannon.core.logging.MdcContext;
import com.shannon.core.metrics.ShannonMetrics;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.AttemptResult;
import com.shannon.core.model.CommitRef;
import com.shannon.core.model.RunOptions;
import com.shannon.core.validation.ValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one agent through checkpoint, execute and validate until it succeeds or runs out of attempts.
 * <p>
 * The loop is a fold over attempt outcomes: {@link #attempt} performs one attempt and reports what happened,
 * {@link #transition} applies the consequences (commit, rollback, backoff) and yields the next state. Every
 * failed attempt is rolled back before anything else happens, so a failed attempt never leaves changes in
 * the workspace. Only a validated success is committed.
 */
@Service
public class RetryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetryOrchestrator.class);

    private static final int PARTIAL_OUTPUT_LIMIT = 2000;

    private final CheckpointStore checkpointStore;
    private final ValidatorRegistry validatorRegistry;
    private final AuditSink auditSink;
    private final AgentInvoker invoker;
    private final BackoffPolicy backoff;
    private final int maxAttempts;
    private final EventBus eventBus;
    private final ShannonMetrics metrics;

    @Autowired
    public RetryOrchestrator(CheckpointStore checkpointStore, ValidatorRegistry validatorRegistry,
                             AuditSink auditSink, AgentInvoker invoker, BackoffPolicy backoff,
                             ShannonProperties properties, EventBus eventBus,
                             @Autowired(required = false) ShannonMetrics metrics) {
        this(checkpointStore, validatorRegistry, auditSink, invoker, backoff, properties.getMaxAttempts(),
                eventBus, metrics);
    }

    RetryOrchestrator(CheckpointStore checkpointStore, ValidatorRegistry validatorRegistry, AuditSink auditSink,
                      AgentInvoker invoker, BackoffPolicy backoff, int maxAttempts,
                      EventBus eventBus, ShannonMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.checkpointStore = checkpointStore;
        this.validatorRegistry = validatorRegistry;
        this.auditSink = auditSink;
        this.invoker = invoker;
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs the agent until one attempt passes validation.
     *
     * @return the validated result with its commit and the cost of every attempt
     * @throws ClassifiedException when the agent cannot succeed, classified by why
     */
    public AgentRunResult runWithRetry(AgentDefinition agent, String prompt, Path workspace, String sessionId,
                                       RunOptions options, CancellationToken token) {
        var run = new Run(agent, prompt, workspace, sessionId, options, token);
        MdcContext.setAgent(sessionId, agent.name());
        log.info("Running {} (up to {} attempts)", agent.name(), maxAttempts);
        eventBus.publish(ShannonEvent.of("agent.started", sessionId, agent.name(),
                Map.of("displayName", agent.displayName())));
        try {
            RetryState state = RetryState.initial();
            while (true) {
                AttemptOutcome outcome = attempt(run, state);
                state = transition(run, state, outcome);
                if (state.result() != null) {
                    return state.result();
                }
                if (state.failure() != null) {
                    ClassifiedException failure = state.failure();
                    log.error("{} failed after {} attempt(s): {} ({})", agent.name(), failure.attempts(),
                            failure.getMessage(), failure.classification());
                    eventBus.publish(ShannonEvent.of("agent.failed", sessionId, agent.name(), Map.of(
                            "classification", failure.classification().name(),
                            "attempts", failure.attempts(),
                            "message", String.valueOf(failure.getMessage()))));
                    if (metrics != null) {
                        metrics.recordAgentRun(agent.name(), failure.classification().name().toLowerCase(),
                                state.totalDurationMs());
                        metrics.recordAgentCost(agent.name(), state.totalCostUsd());
                    }
                    throw failure;
                }
            }
        } finally {
            MdcContext.clearAgent();
        }
    }

    /**
     * Checkpoint, execute and validate once. Never throws: every way an attempt can end is an outcome.
     */
    AttemptOutcome attempt(Run run, RetryState state) {
        int n = state.attemptsUsed() + 1;
        if (run.token().isCancelled()) {
            return AttemptOutcome.cancelled(n - 1, false, 0.0, 0L);
        }
        MdcContext.setAttempt(n);

        boolean checkpointed = false;
        AttemptHandle handle = null;
        long start = System.currentTimeMillis();
        try {
            checkpointStore.checkpoint(run.workspace(), run.agent().name(), n);
            checkpointed = true;

            String fullPrompt = state.retryContext() == null
                    ? run.prompt()
                    : state.retryContext() + "\n\n" + run.prompt();
            handle = auditSink.startAttempt(run.sessionId(), run.agent().name(), n, fullPrompt);
            eventBus.publish(ShannonEvent.of("agent.attempt.started", run.sessionId(), run.agent().name(),
                    Map.of("attempt", n, "maxAttempts", maxAttempts)));

            var signals = new StreamSignals();
            final AttemptHandle auditHandle = handle;
            AttemptResult result;
            try {
                result = invoker.run(
                        new AgentInvocation(run.agent(), fullPrompt, run.workspace(), run.sessionId(), n,
                                run.options(), run.token()),
                        event -> {
                            signals.observe(event);
                            auditSink.append(auditHandle, toAuditEvent(event));
                        });
            } catch (StorageException e) {
                throw e;
            } catch (Exception e) {
                long elapsed = System.currentTimeMillis() - start;
                if (run.token().isCancelled()) {
                    endAttempt(handle, "cancelled", Map.of());
                    return AttemptOutcome.cancelled(n, true, 0.0, elapsed);
                }
                ErrorCategory category = signals.quotaExhausted() ? ErrorCategory.BILLING : ErrorClassifier.classify(e);
                boolean retryable = !signals.quotaExhausted() && ErrorClassifier.isRetryable(e);
                endAttempt(handle, "execution_failed", Map.of("error", String.valueOf(e.getMessage()),
                        "category", category.name(), "retryable", retryable));
                return AttemptOutcome.executionFailed(n, null, e, category, retryable, 0.0, elapsed);
            }

            long elapsed = result.durationMs() > 0 ? result.durationMs() : System.currentTimeMillis() - start;
            result = result.withApiErrorDetected(result.apiErrorDetected() || signals.apiErrorDetected());

            if (run.token().isCancelled()) {
                endAttempt(handle, "cancelled", Map.of());
                return AttemptOutcome.cancelled(n, true, result.billedCost(), elapsed);
            }

            if (signals.quotaExhausted()) {
                var error = new AgentExecutionException("Model provider " + ErrorClassifier.QUOTA_MARKER,
                        ErrorCategory.BILLING, false, null);
                endAttempt(handle, "execution_failed", Map.of("category", ErrorCategory.BILLING.name(),
                        "retryable", false));
                return AttemptOutcome.executionFailed(n, result, error, ErrorCategory.BILLING, false,
                        result.billedCost(), elapsed);
            }

            if (!result.success()) {
                ErrorCategory category = result.errorCategory() != null
                        ? result.errorCategory()
                        : ErrorClassifier.classify(result.errorMessage());
                boolean retryable = result.retryable() != null ? result.retryable() : category.isRetryable();
                var error = new AgentExecutionException(
                        result.errorMessage() == null ? "Agent reported failure" : result.errorMessage(),
                        category, retryable, null);
                endAttempt(handle, "execution_failed", Map.of("error", error.getMessage(),
                        "category", category.name(), "retryable", retryable, "costUsd", result.billedCost()));
                return AttemptOutcome.executionFailed(n, result, error, category, retryable,
                        result.billedCost(), elapsed);
            }

            boolean valid = validatorRegistry.validate(run.agent(), run.workspace(), run.options());
            endAttempt(handle, valid ? "success" : "validation_failed", Map.of(
                    "costUsd", result.costUsd(), "turns", result.turns()));
            return valid
                    ? AttemptOutcome.succeeded(n, result, elapsed)
                    : AttemptOutcome.validationFailed(n, result, elapsed);
        } catch (StorageException e) {
            return AttemptOutcome.storageFailed(n, checkpointed, e, System.currentTimeMillis() - start);
        }
    }

    /**
     * Applies an attempt's outcome: commit on success, otherwise roll back and decide between retry and stop.
     */
    RetryState transition(Run run, RetryState state, AttemptOutcome outcome) {
        String agentName = run.agent().name();
        RetryState accumulated = state.after(outcome);
        if (metrics != null && outcome.attemptNumber() > state.attemptsUsed()) {
            metrics.recordAttempt(agentName, outcome.kind().name().toLowerCase());
        }

        switch (outcome.kind()) {
            case SUCCEEDED -> {
                CommitRef ref;
                try {
                    ref = checkpointStore.commitSuccess(run.workspace(), agentName);
                } catch (StorageException e) {
                    return accumulated.failed(classified(run, accumulated, Classification.STORAGE_INTEGRITY,
                            "Could not commit successful result: " + e.getMessage(), e));
                }
                log.info("{} succeeded on attempt {} (${} total)", agentName, outcome.attemptNumber(),
                        String.format("%.4f", accumulated.totalCostUsd()));
                eventBus.publish(ShannonEvent.of("agent.completed", run.sessionId(), agentName, Map.of(
                        "attempts", accumulated.attemptsUsed(),
                        "costUsd", accumulated.totalCostUsd(),
                        "durationMs", accumulated.totalDurationMs(),
                        "checkpoint", ref.value())));
                if (metrics != null) {
                    metrics.recordAgentRun(agentName, "success", accumulated.totalDurationMs());
                    metrics.recordAgentCost(agentName, accumulated.totalCostUsd());
                }
                return accumulated.succeeded(new AgentRunResult(run.agent(), outcome.result(), ref,
                        accumulated.attemptsUsed(), accumulated.totalCostUsd(), accumulated.totalDurationMs()));
            }
            case STORAGE_FAILED -> {
                var failure = classified(run, accumulated, Classification.STORAGE_INTEGRITY,
                        "Storage failure during attempt " + outcome.attemptNumber() + ": "
                                + outcome.error().getMessage(), outcome.error());
                if (outcome.workspaceTouched()) {
                    try {
                        checkpointStore.rollback(run.workspace(), agentName, "storage failure");
                    } catch (StorageException e) {
                        failure.addSuppressed(e);
                    }
                }
                return accumulated.failed(failure);
            }
            case CANCELLED -> {
                if (outcome.workspaceTouched()) {
                    try {
                        checkpointStore.rollback(run.workspace(), agentName, "cancelled");
                    } catch (StorageException e) {
                        return accumulated.failed(classified(run, accumulated, Classification.STORAGE_INTEGRITY,
                                "Rollback after cancellation failed: " + e.getMessage(), e));
                    }
                }
                return accumulated.failed(classified(run, accumulated, Classification.CANCELLED,
                        agentName + " cancelled", null));
            }
            default -> {
                return afterFailure(run, accumulated, outcome);
            }
        }
    }

    private RetryState afterFailure(Run run, RetryState accumulated, AttemptOutcome outcome) {
        String agentName = run.agent().name();
        boolean validationFailure = outcome.kind() == AttemptOutcome.Kind.VALIDATION_FAILED;
        String reason = validationFailure
                ? "completed but did not produce the required deliverables"
                : "failed: " + outcome.error().getMessage();

        try {
            checkpointStore.rollback(run.workspace(), agentName, "attempt " + outcome.attemptNumber() + " " + reason);
        } catch (StorageException e) {
            return accumulated.failed(classified(run, accumulated, Classification.STORAGE_INTEGRITY,
                    "Rollback failed: " + e.getMessage(), e));
        }
        eventBus.publish(ShannonEvent.of("agent.attempt.failed", run.sessionId(), agentName, Map.of(
                "attempt", outcome.attemptNumber(),
                "reason", reason)));

        if (!validationFailure && !outcome.retryable()) {
            return accumulated.failed(classified(run, accumulated, Classification.NON_RETRYABLE,
                    agentName + " hit a non-retryable " + outcome.category() + " error: "
                            + outcome.error().getMessage(), outcome.error()));
        }
        if (accumulated.attemptsUsed() >= maxAttempts) {
            return validationFailure
                    ? accumulated.failed(classified(run, accumulated, Classification.VALIDATION_EXHAUSTED,
                            agentName + " completed " + maxAttempts + " times without valid deliverables", null))
                    : accumulated.failed(classified(run, accumulated, Classification.RETRIES_EXHAUSTED,
                            agentName + " failed " + maxAttempts + " times, last error: "
                                    + outcome.error().getMessage(), outcome.error()));
        }

        ErrorCategory category = validationFailure ? ErrorCategory.UNKNOWN : outcome.category();
        Duration delay = backoff.delay(outcome.attemptNumber(), category);
        log.warn("{} attempt {}/{} {}; retrying in {}ms", agentName, outcome.attemptNumber(), maxAttempts,
                reason, delay.toMillis());
        if (run.token().await(delay)) {
            return accumulated.failed(classified(run, accumulated, Classification.CANCELLED,
                    agentName + " cancelled while waiting to retry", null));
        }
        return accumulated.retrying(retryContext(outcome, reason));
    }

    private String retryContext(AttemptOutcome outcome, String reason) {
        var sb = new StringBuilder();
        sb.append("NOTE: this is attempt ").append(outcome.attemptNumber() + 1).append(" of ").append(maxAttempts)
                .append(". The previous attempt ").append(reason)
                .append(". Its changes were discarded and the workspace restored.");
        String partial = outcome.result() == null ? null : outcome.result().payload();
        if (partial != null && !partial.isBlank()) {
            String trimmed = partial.length() > PARTIAL_OUTPUT_LIMIT
                    ? partial.substring(partial.length() - PARTIAL_OUTPUT_LIMIT)
                    : partial;
            sb.append("\nPartial output from the previous attempt:\n").append(trimmed.strip());
        }
        return sb.toString();
    }

    private ClassifiedException classified(Run run, RetryState state, Classification classification,
                                           String message, Throwable cause) {
        return new ClassifiedException(classification, run.agent().name(), run.workspace(),
                state.attemptsUsed(), state.totalCostUsd(), message, cause);
    }

    private void endAttempt(AttemptHandle handle, String outcome, Map<String, Object> details) {
        auditSink.endAttempt(handle, outcome, details);
    }

    private static AuditEvent toAuditEvent(AgentEvent event) {
        var payload = new LinkedHashMap<String, Object>(event.data());
        if (event.text() != null && !event.text().isEmpty()) {
            payload.put("text", event.text());
        }
        AuditEventKind kind = switch (event.type()) {
            case ASSISTANT_TEXT -> AuditEventKind.LLM_RESPONSE;
            case TOOL_START -> AuditEventKind.TOOL_START;
            case TOOL_END -> AuditEventKind.TOOL_END;
            case ERROR -> AuditEventKind.ERROR;
        };
        return AuditEvent.of(kind, payload);
    }

    /** The fixed inputs of one {@link #runWithRetry} call. */
    record Run(AgentDefinition agent, String prompt, Path workspace, String sessionId,
               RunOptions options, CancellationToken token) {}

    /** Watches streamed agent output for provider signals that override normal classification. */
    static final class StreamSignals {
        private volatile boolean quotaExhausted;
        private volatile boolean apiErrorDetected;

        void observe(AgentEvent event) {
            if (event.type() != AgentEvent.Type.ASSISTANT_TEXT && event.type() != AgentEvent.Type.ERROR) {
                return;
            }
            if (ErrorClassifier.isQuotaExhausted(event.text())) {
                quotaExhausted = true;
            }
            if (ErrorClassifier.mentionsApiError(event.text())) {
                apiErrorDetected = true;
            }
        }

        boolean quotaExhausted() {
            return quotaExhausted;
        }

        boolean apiErrorDetected() {
            return apiErrorDetected;
        }
    }
}
