package com.shannon.core.retry;

import com.shannon.core.audit.AttemptHandle;
import com.shannon.core.audit.AuditEventKind;
import com.shannon.core.audit.AuditSink;
import com.shannon.core.checkpoint.CheckpointStore;
import com.shannon.core.error.ClassifiedException;
import com.shannon.core.error.ClassifiedException.Classification;
import com.shannon.core.error.ErrorCategory;
import com.shannon.core.error.StorageException;
import com.shannon.core.events.EventBus;
import com.shannon.core.events.ShannonEvent;
import com.shannon.core.metrics.ShannonMetrics;
import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.AttemptResult;
import com.shannon.core.model.CommitRef;
import com.shannon.core.model.RunOptions;
import com.shannon.core.validation.ValidatorRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RetryOrchestratorTest {

    private static final String SESSION = "session-1";
    private final Path workspace = Path.of("/tmp/target-app");
    private final AgentDefinition agent = AgentCatalog.require("injection-vuln");

    private CheckpointStore checkpointStore;
    private ValidatorRegistry validator;
    private AuditSink auditSink;
    private AgentInvoker invoker;
    private EventBus eventBus;
    private List<ShannonEvent> events;
    private SimpleMeterRegistry registry;
    private CancellationToken token;
    private RetryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        checkpointStore = mock(CheckpointStore.class);
        validator = mock(ValidatorRegistry.class);
        auditSink = mock(AuditSink.class);
        invoker = mock(AgentInvoker.class);
        eventBus = new EventBus();
        events = Collections.synchronizedList(new ArrayList<>());
        eventBus.subscribe(SESSION, events::add);
        registry = new SimpleMeterRegistry();
        token = new CancellationToken();

        when(checkpointStore.checkpoint(eq(workspace), anyString(), anyInt())).thenReturn(new CommitRef("cp"));
        when(checkpointStore.commitSuccess(eq(workspace), anyString())).thenReturn(new CommitRef("ok"));
        when(auditSink.startAttempt(anyString(), anyString(), anyInt(), anyString())).thenAnswer(inv ->
                new AttemptHandle(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2),
                        Path.of("/tmp/audit.jsonl"), Instant.now()));

        orchestrator = newOrchestrator(BackoffPolicy.none(), 3);
    }

    private RetryOrchestrator newOrchestrator(BackoffPolicy backoff, int maxAttempts) {
        return new RetryOrchestrator(checkpointStore, validator, auditSink, invoker, backoff, maxAttempts,
                eventBus, new ShannonMetrics(registry));
    }

    private AgentRunResult run() {
        return orchestrator.runWithRetry(agent, "Find injection flaws", workspace, SESSION,
                RunOptions.defaults(), token);
    }

    private ClassifiedException runExpectingFailure() {
        return assertThrows(ClassifiedException.class, this::run);
    }

    @Test
    @DisplayName("Succeeds on the first attempt and commits once")
    void succeedsFirstTime() throws Exception {
        when(invoker.run(any(), any())).thenReturn(AttemptResult.succeeded("done", 1200, 0.40, 12));
        when(validator.validate(agent, workspace, RunOptions.defaults())).thenReturn(true);

        AgentRunResult result = run();

        assertEquals(1, result.attempts());
        assertEquals("ok", result.checkpoint().value());
        assertEquals(0.40, result.totalCostUsd(), 1e-9);
        verify(checkpointStore).checkpoint(workspace, agent.name(), 1);
        verify(checkpointStore).commitSuccess(workspace, agent.name());
        verify(checkpointStore, never()).rollback(any(), anyString(), anyString());
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals("agent.completed")));
        assertEquals(1, registry.get("shannon.agent.attempts").tag("outcome", "succeeded").counter().count());
    }

    @Test
    @DisplayName("Validation failing every time exhausts attempts with one checkpoint and rollback each")
    void validationExhausted() throws Exception {
        when(invoker.run(any(), any())).thenReturn(AttemptResult.succeeded("no files", 100, 0.10, 3));
        when(validator.validate(any(), any(), any())).thenReturn(false);

        ClassifiedException e = runExpectingFailure();

        assertEquals(Classification.VALIDATION_EXHAUSTED, e.classification());
        assertEquals(3, e.attempts());
        assertEquals(0.30, e.totalCostUsd(), 1e-9);
        assertEquals(agent.name(), e.agentName());
        verify(checkpointStore, times(3)).checkpoint(eq(workspace), eq(agent.name()), anyInt());
        verify(checkpointStore, times(3)).rollback(eq(workspace), eq(agent.name()), anyString());
        verify(checkpointStore, never()).commitSuccess(any(), anyString());
        verify(auditSink, times(3)).endAttempt(any(), eq("validation_failed"), any());
    }

    @Test
    @DisplayName("A non-retryable failure stops after one attempt")
    void nonRetryableStopsImmediately() throws Exception {
        when(invoker.run(any(), any())).thenReturn(
                AttemptResult.failed("Invalid API key", 50, 0.0));

        ClassifiedException e = runExpectingFailure();

        assertEquals(Classification.NON_RETRYABLE, e.classification());
        assertEquals(1, e.attempts());
        verify(invoker, times(1)).run(any(), any());
        verify(checkpointStore).rollback(eq(workspace), eq(agent.name()), anyString());
        verify(validator, never()).validate(any(), any(), any());
    }

    @Test
    @DisplayName("An explicit retryable flag on the result overrides the category")
    void resultRetryFlagWins() throws Exception {
        when(invoker.run(any(), any())).thenReturn(
                AttemptResult.failed("weird", 10, 0.0).withClassification(ErrorCategory.UNKNOWN, true));

        ClassifiedException e = runExpectingFailure();

        assertEquals(Classification.RETRIES_EXHAUSTED, e.classification());
        verify(invoker, times(3)).run(any(), any());
    }

    @Test
    @DisplayName("Retries after a transient failure, sums cost and tells the agent about the retry")
    void retryThenSucceed() throws Exception {
        when(invoker.run(any(), any()))
                .thenReturn(AttemptResult.failed("Connection reset by peer", 100, 0.50))
                .thenReturn(AttemptResult.succeeded("done", 200, 1.25, 20));
        when(validator.validate(any(), any(), any())).thenReturn(true);

        AgentRunResult result = run();

        assertEquals(2, result.attempts());
        assertEquals(1.75, result.totalCostUsd(), 1e-9);
        assertEquals(300, result.totalDurationMs());

        var invocations = ArgumentCaptor.forClass(AgentInvocation.class);
        verify(invoker, times(2)).run(invocations.capture(), any());
        assertEquals("Find injection flaws", invocations.getAllValues().get(0).prompt());
        String retryPrompt = invocations.getAllValues().get(1).prompt();
        assertTrue(retryPrompt.startsWith("NOTE: this is attempt 2 of 3."));
        assertTrue(retryPrompt.endsWith("Find injection flaws"));
        assertEquals(2, invocations.getAllValues().get(1).attemptNumber());

        verify(checkpointStore).rollback(eq(workspace), eq(agent.name()), anyString());
        verify(checkpointStore).checkpoint(workspace, agent.name(), 2);
    }

    @Test
    @DisplayName("Partial output of the failed attempt is carried into the retry prompt")
    void partialOutputIsCarriedOver() throws Exception {
        var partial = new AttemptResult(false, "x".repeat(3000) + "found /search?q=", 10, 0, 0,
                true, ErrorCategory.API, false, 4, "API error: overloaded");
        when(invoker.run(any(), any()))
                .thenReturn(partial)
                .thenReturn(AttemptResult.succeeded("done", 10, 0, 1));
        when(validator.validate(any(), any(), any())).thenReturn(true);

        run();

        var invocations = ArgumentCaptor.forClass(AgentInvocation.class);
        verify(invoker, times(2)).run(invocations.capture(), any());
        String retryPrompt = invocations.getAllValues().get(1).prompt();
        assertTrue(retryPrompt.contains("found /search?q="));
        assertTrue(retryPrompt.length() < 2600);
    }

    @Test
    @DisplayName("An invoker exception is classified and retried")
    void invokerExceptionIsRetried() throws Exception {
        var failure = new IOException("connection refused");
        when(invoker.run(any(), any())).thenThrow(failure);

        ClassifiedException e = runExpectingFailure();

        assertEquals(Classification.RETRIES_EXHAUSTED, e.classification());
        assertEquals(3, e.attempts());
        assertSame(failure, e.getCause());
        verify(checkpointStore, times(3)).rollback(eq(workspace), eq(agent.name()), anyString());
    }

    @Test
    @DisplayName("Rate limits back off with the rate-limit category")
    void rateLimitUsesCategoryForBackoff() throws Exception {
        BackoffPolicy backoff = mock(BackoffPolicy.class);
        when(backoff.delay(anyInt(), any())).thenReturn(Duration.ZERO);
        orchestrator = newOrchestrator(backoff, 2);
        when(invoker.run(any(), any())).thenReturn(AttemptResult.failed("429 Too Many Requests", 10, 0));

        runExpectingFailure();

        verify(backoff).delay(1, ErrorCategory.RATE_LIMIT);
        verify(backoff, times(1)).delay(anyInt(), any());
    }

    @Nested
    @DisplayName("stream signals")
    class StreamSignalsTests {

        @Test
        @DisplayName("The quota marker makes even a successful result non-retryable")
        void quotaMarkerIsNonRetryable() throws Exception {
            when(invoker.run(any(), any())).thenAnswer(inv -> {
                Consumer<AgentEvent> sink = inv.getArgument(1);
                sink.accept(AgentEvent.text("Claude AI usage: Session limit reached, resets at 5pm"));
                return AttemptResult.succeeded("partial", 10, 0.2, 2);
            });

            ClassifiedException e = runExpectingFailure();

            assertEquals(Classification.NON_RETRYABLE, e.classification());
            assertEquals(1, e.attempts());
            assertEquals(0.2, e.totalCostUsd(), 1e-9);
            verify(validator, never()).validate(any(), any(), any());
            verify(checkpointStore).rollback(eq(workspace), eq(agent.name()), anyString());
        }

        @Test
        @DisplayName("Streamed events are written to the attempt's audit log")
        void eventsAreAudited() throws Exception {
            when(invoker.run(any(), any())).thenAnswer(inv -> {
                Consumer<AgentEvent> sink = inv.getArgument(1);
                sink.accept(AgentEvent.toolStart("Bash", "curl http://target"));
                sink.accept(AgentEvent.text("looking at the login form"));
                return AttemptResult.succeeded("done", 10, 0.1, 2);
            });
            when(validator.validate(any(), any(), any())).thenReturn(true);

            run();

            verify(auditSink).append(any(), argThat(e -> e.kind() == AuditEventKind.TOOL_START));
            verify(auditSink).append(any(), argThat(e -> e.kind() == AuditEventKind.LLM_RESPONSE
                    && "looking at the login form".equals(e.payload().get("text"))));
            verify(auditSink).endAttempt(any(), eq("success"), any());
        }
    }

    @Nested
    @DisplayName("storage failures")
    class StorageFailures {

        @Test
        @DisplayName("A failed checkpoint stops before the agent runs")
        void checkpointFailure() throws Exception {
            when(checkpointStore.checkpoint(any(), anyString(), anyInt()))
                    .thenThrow(new StorageException("disk full"));

            ClassifiedException e = runExpectingFailure();

            assertEquals(Classification.STORAGE_INTEGRITY, e.classification());
            verify(invoker, never()).run(any(), any());
            verify(checkpointStore, never()).rollback(any(), anyString(), anyString());
        }

        @Test
        @DisplayName("A failed audit log after the checkpoint rolls back")
        void auditFailureRollsBack() throws Exception {
            when(auditSink.startAttempt(anyString(), anyString(), anyInt(), anyString()))
                    .thenThrow(new StorageException("read-only file system"));

            ClassifiedException e = runExpectingFailure();

            assertEquals(Classification.STORAGE_INTEGRITY, e.classification());
            verify(checkpointStore).rollback(eq(workspace), eq(agent.name()), anyString());
            verify(invoker, never()).run(any(), any());
        }

        @Test
        @DisplayName("A failed rollback is a storage integrity failure, not a retry")
        void rollbackFailure() throws Exception {
            when(invoker.run(any(), any())).thenReturn(AttemptResult.failed("Connection reset", 10, 0));
            doThrow(new StorageException("reset failed"))
                    .when(checkpointStore).rollback(any(), anyString(), anyString());

            ClassifiedException e = runExpectingFailure();

            assertEquals(Classification.STORAGE_INTEGRITY, e.classification());
            verify(invoker, times(1)).run(any(), any());
        }

        @Test
        @DisplayName("A failed success commit is a storage integrity failure")
        void commitFailure() throws Exception {
            when(invoker.run(any(), any())).thenReturn(AttemptResult.succeeded("done", 10, 0.1, 1));
            when(validator.validate(any(), any(), any())).thenReturn(true);
            when(checkpointStore.commitSuccess(any(), anyString())).thenThrow(new StorageException("no space"));

            assertEquals(Classification.STORAGE_INTEGRITY, runExpectingFailure().classification());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancelling during an attempt rolls it back")
        void cancelDuringAttempt() throws Exception {
            when(invoker.run(any(), any())).thenAnswer(inv -> {
                token.cancel();
                return AttemptResult.failed("terminated", 10, 0.05);
            });

            ClassifiedException e = runExpectingFailure();

            assertEquals(Classification.CANCELLED, e.classification());
            assertEquals(1, e.attempts());
            verify(checkpointStore).rollback(eq(workspace), eq(agent.name()), eq("cancelled"));
            verify(auditSink).endAttempt(any(), eq("cancelled"), any());
        }

        @Test
        @DisplayName("Cancelling before the first attempt touches nothing")
        void cancelBeforeStart() throws Exception {
            token.cancel();

            ClassifiedException e = runExpectingFailure();

            assertEquals(Classification.CANCELLED, e.classification());
            assertEquals(0, e.attempts());
            verify(checkpointStore, never()).checkpoint(any(), anyString(), anyInt());
            verify(invoker, never()).run(any(), any());
        }

        @Test
        @DisplayName("Cancelling during backoff stops without another attempt")
        void cancelDuringBackoff() throws Exception {
            BackoffPolicy backoff = mock(BackoffPolicy.class);
            when(backoff.delay(anyInt(), any())).thenAnswer(inv -> {
                token.cancel();
                return Duration.ofSeconds(30);
            });
            orchestrator = newOrchestrator(backoff, 3);
            when(invoker.run(any(), any())).thenReturn(AttemptResult.failed("503 Service Unavailable", 10, 0));

            ClassifiedException e = runExpectingFailure();

            assertEquals(Classification.CANCELLED, e.classification());
            verify(invoker, times(1)).run(any(), any());
        }
    }

    @Test
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> newOrchestrator(BackoffPolicy.none(), 0));
    }
}
