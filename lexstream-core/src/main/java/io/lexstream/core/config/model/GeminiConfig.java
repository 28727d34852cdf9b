package io.lexstream.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"primary_model"}) String primaryModel,
    @JsonAlias({"fallback_model"}) String fallbackModel,
    double temperature,
    @JsonAlias({"top_p"}) double topP,
    @JsonAlias({"top_k"}) int topK,
    @JsonAlias({"max_output_tokens"}) int maxOutputTokens,
    @JsonAlias({"connect_timeout_seconds"}) int connectTimeoutSeconds,
    @JsonAlias({"read_timeout_seconds"}) int readTimeoutSeconds
) {
    public static final String DEFAULT_API_BASE = "https://generativelanguage.googleapis.com/v1beta";
    public static final String DEFAULT_PRIMARY_MODEL = "gemini-2.5-flash";
    public static final String DEFAULT_FALLBACK_MODEL = "gemini-2.5-flash-lite";

    public GeminiConfig {
        apiKey = apiKey == null ? "" : apiKey;
        apiBase = apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase;
        primaryModel = primaryModel == null || primaryModel.isBlank() ? DEFAULT_PRIMARY_MODEL : primaryModel;
        fallbackModel = fallbackModel == null || fallbackModel.isBlank() ? DEFAULT_FALLBACK_MODEL : fallbackModel;
    }

    public static GeminiConfig defaults() {
        return new GeminiConfig("", DEFAULT_API_BASE, DEFAULT_PRIMARY_MODEL, DEFAULT_FALLBACK_MODEL, 0.7, 0.95, 40, 8192, 20, 120);
    }

    public boolean configured() {
        return !apiKey.isBlank();
    }

    public GeminiConfig withApiKey(String newApiKey) {
        return new GeminiConfig(
            newApiKey,
            apiBase,
            primaryModel,
            fallbackModel,
            temperature,
            topP,
            topK,
            maxOutputTokens,
            connectTimeoutSeconds,
            readTimeoutSeconds
        );
    }
}
