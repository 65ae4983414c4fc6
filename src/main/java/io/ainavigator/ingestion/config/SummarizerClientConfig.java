package io.ainavigator.ingestion.config;

import io.ainavigator.ingestion.api.service.GeminiClient;
import io.ainavigator.ingestion.api.service.LanguageModelClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class SummarizerClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(SummarizerClientConfig.class);

    @Bean
    public LanguageModelClient languageModelClient(RestClient.Builder restClientBuilder, NewsConfig newsConfig) {
        SummarizerConfig summarizer = newsConfig.summarizer();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(summarizer.connectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(summarizer.timeout());

        if (!summarizer.hasApiKey()) {
            logger.warn("No Gemini API key configured, summaries will fall back to a placeholder");
        }

        RestClient restClient = restClientBuilder
                .baseUrl(summarizer.baseUrl())
                .requestFactory(requestFactory)
                .build();

        return new GeminiClient(restClient, summarizer);
    }
}
