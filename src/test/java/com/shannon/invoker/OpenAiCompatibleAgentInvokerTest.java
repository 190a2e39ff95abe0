package com.shannon.invoker;

import com.shannon.config.ShannonProperties;
import com.shannon.core.error.AgentExecutionException;
import com.shannon.core.error.ErrorCategory;
import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AttemptResult;
import com.shannon.core.model.RunOptions;
import com.shannon.core.retry.AgentEvent;
import com.shannon.core.retry.AgentInvocation;
import com.shannon.core.retry.CancellationToken;
import com.shannon.core.validation.DeliverableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OpenAiCompatibleAgentInvokerTest {

    @TempDir
    Path workspace;

    private ShannonProperties properties;
    private DeliverableStore deliverableStore;
    private ScriptedChatModel chatModel;
    private CancellationToken token;
    private OpenAiCompatibleAgentInvoker invoker;

    @BeforeEach
    void setUp() {
        properties = new ShannonProperties();
        properties.getLlm().setProvider("openai");
        properties.getLlm().setRequestTimeoutSeconds(5);
        deliverableStore = mock(DeliverableStore.class);
        chatModel = new ScriptedChatModel();
        token = new CancellationToken();
        invoker = new OpenAiCompatibleAgentInvoker(ChatClient.create(chatModel), properties, deliverableStore);
    }

    @Nested
    @DisplayName("streaming")
    class Streaming {

        @BeforeEach
        void enableStreaming() {
            properties.getLlm().setStream(true);
        }

        @Test
        @DisplayName("chunks are concatenated and usage is taken from the final chunk")
        void concatenatesChunks() throws Exception {
            chatModel.stream = Flux.just(chunk("# Re"), chunk("con"), usageOnly(11, 2));
            when(deliverableStore.exists(eq(workspace), anyString())).thenReturn(false);

            var events = new ArrayList<AgentEvent>();
            AttemptResult result = invoker.run(invocation(), events::add);

            assertTrue(result.success());
            assertEquals("# Recon", result.payload());
            verify(deliverableStore).write(eq(workspace), eq("recon_deliverable.md"), eq("# Recon"));
            assertEquals(1, events.size());
            assertEquals(11, events.get(0).data().get("promptTokens"));
            assertEquals(2, events.get(0).data().get("completionTokens"));
            assertEquals("prompt text", chatModel.lastPrompt.getContents());
        }

        @Test
        @DisplayName("a deliverable the agent already wrote is left alone")
        void keepsExistingDeliverable() throws Exception {
            chatModel.stream = Flux.just(chunk("answer"));
            when(deliverableStore.exists(eq(workspace), anyString())).thenReturn(true);

            assertTrue(invoker.run(invocation(), e -> { }).success());
            verify(deliverableStore, never()).write(any(), anyString(), anyString());
        }

        @Test
        void emptyAnswerFails() throws Exception {
            chatModel.stream = Flux.just(usageOnly(3, 0));

            AttemptResult result = invoker.run(invocation(), e -> { });

            assertFalse(result.success());
            assertEquals("Model returned an empty response", result.errorMessage());
            verifyNoInteractions(deliverableStore);
        }

        @Test
        @DisplayName("cancellation mid-stream ends the attempt without saving anything")
        void cancelledMidStream() throws Exception {
            chatModel.stream = Flux.just(chunk("partial"))
                    .concatWith(Mono.<ChatResponse>fromRunnable(token::cancel))
                    .concatWith(Flux.never());

            AttemptResult result = invoker.run(invocation(), e -> { });

            assertFalse(result.success());
            assertEquals("Cancelled", result.errorMessage());
            verifyNoInteractions(deliverableStore);
        }

        @Test
        void httpStatusFromStreamIsClassified() {
            chatModel.failure = WebClientResponseException.create(401, "Unauthorized", HttpHeaders.EMPTY,
                    "{\"error\":\"bad key\"}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

            var error = assertThrows(AgentExecutionException.class, () -> invoker.run(invocation(), e -> { }));

            assertEquals(ErrorCategory.AUTHENTICATION, error.category());
            assertFalse(error.isRetryable());
            assertTrue(error.getMessage().contains("bad key"));
        }

        @Test
        @DisplayName("a stream that goes quiet past the request timeout is a retryable network failure")
        void stalledStream() {
            properties.getLlm().setRequestTimeoutSeconds(1);
            chatModel.stream = Flux.never();

            var error = assertThrows(AgentExecutionException.class, () -> invoker.run(invocation(), e -> { }));

            assertEquals(ErrorCategory.NETWORK, error.category());
            assertTrue(error.isRetryable());
            assertInstanceOf(TimeoutException.class, error.getCause());
        }
    }

    @Nested
    @DisplayName("single response")
    class SingleResponse {

        @BeforeEach
        void disableStreaming() {
            properties.getLlm().setStream(false);
        }

        @Test
        void returnsTheAnswer() throws Exception {
            chatModel.call = new ChatResponse(List.of(new Generation(new AssistantMessage("full answer"))),
                    ChatResponseMetadata.builder().usage(new DefaultUsage(5, 3)).build());
            when(deliverableStore.exists(eq(workspace), anyString())).thenReturn(false);

            var events = new ArrayList<AgentEvent>();
            AttemptResult result = invoker.run(invocation(), events::add);

            assertEquals("full answer", result.payload());
            assertEquals(5, events.get(0).data().get("promptTokens"));
        }

        @Test
        @DisplayName("HTTP 429 reported by Spring AI is a retryable rate limit")
        void rateLimited() {
            chatModel.failure = new NonTransientAiException("429 - {\"error\":\"slow down\"}");

            var error = assertThrows(AgentExecutionException.class, () -> invoker.run(invocation(), e -> { }));

            assertEquals(ErrorCategory.RATE_LIMIT, error.category());
            assertTrue(error.isRetryable());
            verifyNoInteractions(deliverableStore);
        }

        @Test
        void serverErrorIsRetryable() {
            chatModel.failure = new TransientAiException("503 - overloaded");

            var error = assertThrows(AgentExecutionException.class, () -> invoker.run(invocation(), e -> { }));

            assertEquals(ErrorCategory.SERVER, error.category());
            assertTrue(error.isRetryable());
        }

        @Test
        void badRequestIsNotRetryable() {
            chatModel.failure = new NonTransientAiException("400 - unknown model");

            var error = assertThrows(AgentExecutionException.class, () -> invoker.run(invocation(), e -> { }));

            assertEquals(ErrorCategory.INVALID_REQUEST, error.category());
            assertFalse(error.isRetryable());
        }
    }

    private AgentInvocation invocation() {
        return new AgentInvocation(AgentCatalog.require(AgentCatalog.RECON), "prompt text", workspace, "s-1", 1,
                RunOptions.defaults(), token);
    }

    private static ChatResponse chunk(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    private static ChatResponse usageOnly(int promptTokens, int completionTokens) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(""))),
                ChatResponseMetadata.builder().usage(new DefaultUsage(promptTokens, completionTokens)).build());
    }

    /** Chat model that replays a canned response or failure. */
    private static final class ScriptedChatModel implements ChatModel {

        ChatResponse call;
        Flux<ChatResponse> stream;
        RuntimeException failure;
        Prompt lastPrompt;

        @Override
        public ChatResponse call(Prompt prompt) {
            lastPrompt = prompt;
            if (failure != null) {
                throw failure;
            }
            return call;
        }

        @Override
        public Flux<ChatResponse> stream(Prompt prompt) {
            lastPrompt = prompt;
            return failure != null ? Flux.error(failure) : stream;
        }
    }
}
