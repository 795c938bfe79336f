package org.neuralchilli.juglans.llm;

import java.time.Duration;

/**
 * Connection settings of the OpenAI-compatible chat endpoint.
 */
public record ChatSettings(String baseUrl, String apiKey, String defaultModel, Duration requestTimeout) {

    public ChatSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Chat base URL cannot be null or empty");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (defaultModel == null || defaultModel.isBlank()) {
            defaultModel = "gpt-4o-mini";
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(120);
        }
    }

    public static ChatSettings defaults() {
        return new ChatSettings("https://api.openai.com/v1", null, "gpt-4o-mini", Duration.ofSeconds(120));
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
