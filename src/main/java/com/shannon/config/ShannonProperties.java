package com.shannon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "shannon")
public class ShannonProperties {

    private Retry retry = new Retry();
    private Tools tools = new Tools();
    private Storage storage = new Storage();
    private Llm llm = new Llm();
    private Validation validation = new Validation();

    // -- Retry accessors (delegate to nested) --
    public int getMaxAttempts() { return retry.maxAttempts; }
    public long getBackoffBaseMs() { return retry.baseDelayMs; }
    public long getBackoffMaxMs() { return retry.maxDelayMs; }
    public long getRateLimitBaseMs() { return retry.rateLimitBaseMs; }
    public long getRateLimitStepMs() { return retry.rateLimitStepMs; }
    public long getRateLimitMaxMs() { return retry.rateLimitMaxMs; }

    // -- Tools accessors --
    public int getToolsMaxParallel() { return tools.maxParallel; }
    public int getToolTimeoutSeconds() { return tools.timeoutSeconds; }
    public int getAgentMaxParallel() { return tools.agentMaxParallel; }

    // -- Storage accessors --
    public String getAuditDir() { return storage.auditDir; }
    public String getSessionsDir() { return storage.sessionsDir; }
    public String getPromptsDir() { return storage.promptsDir; }

    public List<String> getRelaxedAgents() { return validation.relaxedAgents; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Llm getLlm() { return llm; }
    public void setLlm(Llm llm) { this.llm = llm; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30_000;
        private long rateLimitBaseMs = 30_000;
        private long rateLimitStepMs = 10_000;
        private long rateLimitMaxMs = 120_000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        public long getRateLimitBaseMs() { return rateLimitBaseMs; }
        public void setRateLimitBaseMs(long rateLimitBaseMs) { this.rateLimitBaseMs = rateLimitBaseMs; }
        public long getRateLimitStepMs() { return rateLimitStepMs; }
        public void setRateLimitStepMs(long rateLimitStepMs) { this.rateLimitStepMs = rateLimitStepMs; }
        public long getRateLimitMaxMs() { return rateLimitMaxMs; }
        public void setRateLimitMaxMs(long rateLimitMaxMs) { this.rateLimitMaxMs = rateLimitMaxMs; }
    }

    public static class Tools {
        private int maxParallel = 5;
        private int timeoutSeconds = 1800;
        private int agentMaxParallel = 5;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getAgentMaxParallel() { return agentMaxParallel; }
        public void setAgentMaxParallel(int agentMaxParallel) { this.agentMaxParallel = agentMaxParallel; }
    }

    public static class Storage {
        private String auditDir = "audit-logs";
        private String sessionsDir = ".shannon/sessions";
        private String promptsDir = "prompts";

        public String getAuditDir() { return auditDir; }
        public void setAuditDir(String auditDir) { this.auditDir = auditDir; }
        public String getSessionsDir() { return sessionsDir; }
        public void setSessionsDir(String sessionsDir) { this.sessionsDir = sessionsDir; }
        public String getPromptsDir() { return promptsDir; }
        public void setPromptsDir(String promptsDir) { this.promptsDir = promptsDir; }
    }

    public static class Llm {
        /** "claude-code" or "openai". */
        private String provider = "claude-code";
        private String claudeCommand = "claude";
        private String model;
        private int maxTurns = 10_000;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private boolean stream = true;
        private int requestTimeoutSeconds = 600;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getClaudeCommand() { return claudeCommand; }
        public void setClaudeCommand(String claudeCommand) { this.claudeCommand = claudeCommand; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getMaxTurns() { return maxTurns; }
        public void setMaxTurns(int maxTurns) { this.maxTurns = maxTurns; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public boolean isStream() { return stream; }
        public void setStream(boolean stream) { this.stream = stream; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

        /** Text-only providers cannot write files or drive tools themselves. */
        public boolean isTextOnly() {
            return "openai".equalsIgnoreCase(provider);
        }
    }

    public static class Validation {
        private List<String> relaxedAgents = new ArrayList<>(List.of("pre-recon", "recon"));

        public List<String> getRelaxedAgents() { return relaxedAgents; }
        public void setRelaxedAgents(List<String> relaxedAgents) { this.relaxedAgents = relaxedAgents; }
    }
}
