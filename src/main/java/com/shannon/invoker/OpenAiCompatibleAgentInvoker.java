package com.shannon.invoker;

import com.shannon.config.ShannonProperties;
import com.shannon.core.error.AgentExecutionException;
import com.shannon.core.error.ErrorCategory;
import com.shannon.core.error.ErrorClassifier;
import com.shannon.core.model.AttemptResult;
import com.shannon.core.retry.AgentEvent;
import com.shannon.core.retry.AgentInvocation;
import com.shannon.core.retry.AgentInvoker;
import com.shannon.core.retry.CancellationToken;
import com.shannon.core.validation.DeliverableStore;
import com.shannon.core.validation.Deliverables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-only invoker for OpenAI-compatible chat completion endpoints, through Spring AI's {@link ChatClient}.
 * <p>
 * The model cannot write files, so the answer is saved as the agent's primary deliverable when the agent
 * has not produced that file any other way.
 */
public class OpenAiCompatibleAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleAgentInvoker.class);

    /** Spring AI reports HTTP failures as "429 - {body}". */
    private static final Pattern STATUS_PREFIX = Pattern.compile("^\\s*(?:HTTP\\s+)?(\\d{3})\\b");

    private final ChatClient chatClient;
    private final ShannonProperties.Llm llm;
    private final DeliverableStore deliverableStore;

    public OpenAiCompatibleAgentInvoker(ChatClient chatClient, ShannonProperties properties,
                                        DeliverableStore deliverableStore) {
        this.chatClient = chatClient;
        this.llm = properties.getLlm();
        this.deliverableStore = deliverableStore;
    }

    @Override
    public AttemptResult run(AgentInvocation invocation, Consumer<AgentEvent> events) {
        long start = System.currentTimeMillis();
        log.info("{} attempt {} sent to {}", invocation.agent().name(), invocation.attemptNumber(),
                llm.getBaseUrl());

        Completion completion;
        try {
            completion = llm.isStream()
                    ? streamCompletion(invocation.prompt(), invocation.cancellationToken())
                    : callCompletion(invocation.prompt());
        } catch (RuntimeException e) {
            throw toExecutionException(e);
        }

        long elapsed = System.currentTimeMillis() - start;
        if (invocation.cancellationToken().isCancelled()) {
            return AttemptResult.failed("Cancelled", elapsed, 0.0);
        }
        log.info("{} answered in {}s ({} prompt / {} completion tokens)", invocation.agent().name(),
                String.format("%.1f", elapsed / 1000.0), completion.promptTokens(), completion.completionTokens());
        events.accept(new AgentEvent(AgentEvent.Type.ASSISTANT_TEXT, completion.text(),
                Map.of("promptTokens", completion.promptTokens(), "completionTokens", completion.completionTokens())));

        if (completion.text().isBlank()) {
            return AttemptResult.failed("Model returned an empty response", elapsed, 0.0);
        }

        String deliverable = Deliverables.primary(invocation.agent());
        if (!deliverableStore.exists(invocation.workspace(), deliverable)) {
            deliverableStore.write(invocation.workspace(), deliverable, completion.text());
            log.info("Saved {} response as {}", invocation.agent().name(), deliverable);
        }
        return AttemptResult.succeeded(completion.text(), elapsed, 0.0, 1);
    }

    private Completion callCompletion(String prompt) {
        ChatResponse response = chatClient.prompt()
                .user(prompt)
                .call()
                .chatResponse();
        var completion = new CompletionBuilder();
        completion.accept(response);
        return completion.build();
    }

    /**
     * Streams the answer until it ends, the token is cancelled, or no chunk arrives within the request timeout.
     */
    private Completion streamCompletion(String prompt, CancellationToken token) {
        Sinks.One<Boolean> cancelled = Sinks.one();
        Runnable deregister = token.onCancel(() -> cancelled.tryEmitValue(Boolean.TRUE));
        var completion = new CompletionBuilder();
        try {
            chatClient.prompt()
                    .user(prompt)
                    .stream()
                    .chatResponse()
                    .timeout(Duration.ofSeconds(llm.getRequestTimeoutSeconds()))
                    .takeUntilOther(cancelled.asMono())
                    .doOnNext(completion::accept)
                    .blockLast();
        } finally {
            deregister.run();
        }
        return completion.build();
    }

    AgentExecutionException toExecutionException(RuntimeException error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof WebClientResponseException response) {
            return httpError(response.getStatusCode().value(), response.getResponseBodyAsString(), cause);
        }
        if (cause instanceof RestClientResponseException response) {
            return httpError(response.getStatusCode().value(), response.getResponseBodyAsString(), cause);
        }
        if (cause instanceof TransientAiException || cause instanceof NonTransientAiException) {
            String message = cause.getMessage() == null ? "" : cause.getMessage();
            Matcher status = STATUS_PREFIX.matcher(message);
            if (status.find()) {
                return httpError(Integer.parseInt(status.group(1)), message, cause);
            }
            ErrorCategory category = cause instanceof TransientAiException
                    ? ErrorCategory.SERVER : ErrorClassifier.classify(message);
            return new AgentExecutionException(message, category, category.isRetryable(), cause);
        }
        if (cause instanceof TimeoutException || cause instanceof WebClientRequestException
                || cause instanceof ResourceAccessException) {
            return new AgentExecutionException("Request to " + llm.getBaseUrl() + " failed: " + cause.getMessage(),
                    ErrorCategory.NETWORK, true, cause);
        }
        return new AgentExecutionException("Request to " + llm.getBaseUrl() + " failed: " + cause.getMessage(),
                ErrorClassifier.classify(cause), ErrorClassifier.isRetryable(cause), cause);
    }

    private static AgentExecutionException httpError(int status, String body, Throwable cause) {
        ErrorCategory category;
        if (status == 429) {
            category = ErrorCategory.RATE_LIMIT;
        } else if (status == 401) {
            category = ErrorCategory.AUTHENTICATION;
        } else if (status == 402) {
            category = ErrorCategory.BILLING;
        } else if (status == 403) {
            category = ErrorCategory.PERMISSION;
        } else if (status >= 500) {
            category = ErrorCategory.SERVER;
        } else {
            category = ErrorCategory.INVALID_REQUEST;
        }
        String detail = body == null ? "" : body;
        if (detail.length() > 500) {
            detail = detail.substring(0, 500) + "...";
        }
        return new AgentExecutionException("HTTP " + status + ": " + detail, category, category.isRetryable(), cause);
    }

    record Completion(String text, int promptTokens, int completionTokens) {}

    /** Folds streamed (or single) chat responses into one completion; usage comes from the last chunk carrying it. */
    private static final class CompletionBuilder {

        private final StringBuilder text = new StringBuilder();
        private int promptTokens;
        private int completionTokens;

        void accept(ChatResponse response) {
            if (response == null) {
                return;
            }
            Generation generation = response.getResult();
            if (generation != null && generation.getOutput() != null && generation.getOutput().getText() != null) {
                text.append(generation.getOutput().getText());
            }
            Usage usage = response.getMetadata() == null ? null : response.getMetadata().getUsage();
            if (usage != null) {
                if (usage.getPromptTokens() != null && usage.getPromptTokens() > 0) {
                    promptTokens = usage.getPromptTokens();
                }
                if (usage.getCompletionTokens() != null && usage.getCompletionTokens() > 0) {
                    completionTokens = usage.getCompletionTokens();
                }
            }
        }

        Completion build() {
            return new Completion(text.toString(), promptTokens, completionTokens);
        }
    }
}
