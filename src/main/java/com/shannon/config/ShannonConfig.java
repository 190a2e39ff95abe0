package com.shannon.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.shannon.core.retry.AgentInvoker;
import com.shannon.core.retry.BackoffPolicy;
import com.shannon.core.retry.CancellationToken;
import com.shannon.core.validation.DeliverableStore;
import com.shannon.invoker.ClaudeCodeAgentInvoker;
import com.shannon.invoker.ClaudeStreamParser;
import com.shannon.invoker.OpenAiCompatibleAgentInvoker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class ShannonConfig {

    private static final Logger log = LoggerFactory.getLogger(ShannonConfig.class);
    private static final String DEFAULT_OPENAI_MODEL = "gpt-4o";

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public BackoffPolicy backoffPolicy(ShannonProperties properties) {
        return BackoffPolicy.fromProperties(properties);
    }

    /**
     * Process-wide cancellation token; the run command's shutdown hook cancels it on SIGINT/SIGTERM.
     */
    @Bean
    public CancellationToken cancellationToken() {
        return new CancellationToken();
    }

    @Bean
    @ConditionalOnProperty(name = "shannon.llm.provider", havingValue = "claude-code", matchIfMissing = true)
    public AgentInvoker claudeCodeAgentInvoker(ShannonProperties properties, ObjectMapper objectMapper) {
        return new ClaudeCodeAgentInvoker(properties, new ClaudeStreamParser(objectMapper));
    }

    /**
     * Chat client for the text-only provider. {@code base-url} includes the API version segment
     * (for example {@code https://api.openai.com/v1}), so completions are posted to {@code /chat/completions}
     * beneath it. Spring AI's own retries are turned off; attempts are retried by the orchestrator.
     */
    @Bean
    @ConditionalOnProperty(name = "shannon.llm.provider", havingValue = "openai")
    public ChatClient openAiChatClient(ShannonProperties properties) {
        ShannonProperties.Llm llm = properties.getLlm();
        var requestFactory = new JdkClientHttpRequestFactory();
        requestFactory.setReadTimeout(Duration.ofSeconds(llm.getRequestTimeoutSeconds()));

        String baseUrl = llm.getBaseUrl().endsWith("/")
                ? llm.getBaseUrl().substring(0, llm.getBaseUrl().length() - 1)
                : llm.getBaseUrl();
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .completionsPath("/chat/completions")
                .apiKey(StringUtils.hasText(llm.getApiKey()) ? llm.getApiKey() : "not-set")
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();

        String model = StringUtils.hasText(llm.getModel()) ? llm.getModel() : DEFAULT_OPENAI_MODEL;
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(model)
                        .streamUsage(true)
                        .build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
        log.info("Text-only provider: {} at {}", model, baseUrl);
        return ChatClient.create(chatModel);
    }

    @Bean
    @ConditionalOnProperty(name = "shannon.llm.provider", havingValue = "openai")
    public AgentInvoker openAiCompatibleAgentInvoker(ChatClient openAiChatClient, ShannonProperties properties,
                                                     DeliverableStore deliverableStore) {
        return new OpenAiCompatibleAgentInvoker(openAiChatClient, properties, deliverableStore);
    }
}
