package io.ainavigator.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "news")
public record NewsConfig(
        List<SourceSeed> sources,
        IngestionSettings ingestion,
        HttpConfig http,
        SummarizerConfig summarizer
) {

    public NewsConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
        ingestion = ingestion == null ? IngestionSettings.defaults() : ingestion;
        http = http == null ? HttpConfig.defaults() : http;
        summarizer = summarizer == null ? SummarizerConfig.defaults() : summarizer;
    }

    public List<SourceSeed> getEnabledSeeds() {
        return sources.stream()
                .filter(SourceSeed::enabled)
                .toList();
    }
}
