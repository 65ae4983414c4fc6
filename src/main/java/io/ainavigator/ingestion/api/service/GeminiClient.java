package io.ainavigator.ingestion.api.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.ainavigator.ingestion.config.SummarizerConfig;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Google Gemini {@code generateContent} over REST.
 */
public class GeminiClient implements LanguageModelClient {

    private final RestClient restClient;
    private final SummarizerConfig config;

    public GeminiClient(RestClient restClient, SummarizerConfig config) {
        this.restClient = restClient;
        this.config = config;
    }

    @Override
    public String generate(String prompt) {
        if (!config.hasApiKey()) {
            throw new LanguageModelException("Gemini API key not configured. Set 'news.summarizer.api-key'.");
        }

        GenerateResponse response;
        try {
            response = restClient.post()
                    .uri("/v1beta/models/{model}:generateContent?key={key}", config.model(), config.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(GenerateRequest.of(prompt))
                    .retrieve()
                    .body(GenerateResponse.class);
        } catch (RestClientException e) {
            throw new LanguageModelException("Gemini request failed: " + e.getMessage(), e);
        }

        String text = response != null ? response.firstText() : null;
        if (text == null || text.isBlank()) {
            throw new LanguageModelException("Gemini returned no text");
        }
        return text.trim();
    }

    record GenerateRequest(List<Content> contents) {
        static GenerateRequest of(String prompt) {
            return new GenerateRequest(List.of(new Content(List.of(new Part(prompt)))));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(List<Candidate> candidates) {
        String firstText() {
            if (candidates == null || candidates.isEmpty()) {
                return null;
            }
            Content content = candidates.get(0).content();
            if (content == null || content.parts() == null || content.parts().isEmpty()) {
                return null;
            }
            return content.parts().get(0).text();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(List<Part> parts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {}
}
