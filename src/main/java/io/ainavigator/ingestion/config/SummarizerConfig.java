package io.ainavigator.ingestion.config;

import java.time.Duration;

public record SummarizerConfig(
        String baseUrl,
        String model,
        String apiKey,
        Duration connectTimeout,
        Duration timeout,
        Integer maxInputChars
) {
    public SummarizerConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://generativelanguage.googleapis.com" : baseUrl;
        model = model == null || model.isBlank() ? "gemini-1.5-pro" : model;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        maxInputChars = maxInputChars == null ? 4000 : maxInputChars;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public static SummarizerConfig defaults() {
        return new SummarizerConfig(null, null, null, null, null, null);
    }
}
