package com.shannon.core.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps error text to an {@link ErrorCategory}. Non-retryable patterns are checked first,
 * so "invalid api key" never matches the retryable "api error" family.
 */
public final class ErrorClassifier {

    /** Marker the model provider streams when the account's usage quota is used up. */
    public static final String QUOTA_MARKER = "session limit reached";

    private static final Map<ErrorCategory, List<String>> NON_RETRYABLE = new LinkedHashMap<>();
    private static final Map<ErrorCategory, List<String>> RETRYABLE = new LinkedHashMap<>();

    static {
        NON_RETRYABLE.put(ErrorCategory.BILLING, List.of(QUOTA_MARKER, "insufficient credit", "billing"));
        NON_RETRYABLE.put(ErrorCategory.AUTHENTICATION,
                List.of("authentication", "invalid api key", "unauthorized", "401"));
        NON_RETRYABLE.put(ErrorCategory.PERMISSION, List.of("permission denied", "forbidden", "403"));
        NON_RETRYABLE.put(ErrorCategory.INVALID_REQUEST, List.of("invalid prompt", "invalid request"));
        NON_RETRYABLE.put(ErrorCategory.RESOURCE, List.of("out of memory", "no space left"));

        RETRYABLE.put(ErrorCategory.RATE_LIMIT, List.of("rate limit", "429", "too many requests"));
        RETRYABLE.put(ErrorCategory.NETWORK, List.of("network", "connection", "timeout", "timed out",
                "econnreset", "enotfound", "econnrefused"));
        RETRYABLE.put(ErrorCategory.SERVER, List.of("server error", "internal server error",
                "service unavailable", "bad gateway", "500", "502", "503", "504", "overloaded"));
        RETRYABLE.put(ErrorCategory.API, List.of("mcp server", "model unavailable", "api error", "terminated"));
        RETRYABLE.put(ErrorCategory.MAX_TURNS, List.of("max turns", "maximum turns"));
    }

    private ErrorClassifier() {}

    public static ErrorCategory classify(String message) {
        if (message == null || message.isBlank()) {
            return ErrorCategory.UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (var entry : NON_RETRYABLE.entrySet()) {
            if (containsAny(lower, entry.getValue())) {
                return entry.getKey();
            }
        }
        for (var entry : RETRYABLE.entrySet()) {
            if (containsAny(lower, entry.getValue())) {
                return entry.getKey();
            }
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * Classifies a throwable. An {@link AgentExecutionException} carries its own category;
     * anything else is classified by its message chain.
     */
    public static ErrorCategory classify(Throwable error) {
        if (error instanceof AgentExecutionException agentError && agentError.category() != null) {
            return agentError.category();
        }
        var sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            sb.append(t.getClass().getSimpleName()).append(' ');
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append(' ');
            }
        }
        return classify(sb.toString());
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof AgentExecutionException agentError) {
            return agentError.isRetryable();
        }
        return classify(error).isRetryable();
    }

    public static boolean isQuotaExhausted(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(QUOTA_MARKER);
    }

    /** True when streamed model output reports an API failure or a terminated session. */
    public static boolean mentionsApiError(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("api error") || lower.contains("terminated");
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
