package io.ainavigator.ingestion.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Objects;

@Document(collection = "news_sources")
public record NewsSource(
        @Id String id,
        String name,
        String url,
        String feedUrl,
        String category,
        boolean enabled
) {
    public NewsSource {
        Objects.requireNonNull(id, "source id");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source " + id + " has no name");
        }
    }

    public boolean hasFeed() {
        return feedUrl != null && !feedUrl.isBlank();
    }
}
