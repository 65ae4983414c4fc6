package io.ainavigator.ingestion.config;

import io.ainavigator.ingestion.model.NewsSource;

import java.util.UUID;

/**
 * A news source as declared under {@code news.sources}. Written to the store once,
 * when the sources collection is still empty.
 */
public record SourceSeed(
        String id,
        String name,
        String url,
        String feedUrl,
        String category,
        boolean enabled
) {
    public NewsSource toSource() {
        String sourceId = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        return new NewsSource(sourceId, name, url, feedUrl, category, enabled);
    }
}
