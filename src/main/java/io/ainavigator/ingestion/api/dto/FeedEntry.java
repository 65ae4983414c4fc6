package io.ainavigator.ingestion.api.dto;

import java.time.Instant;

public record FeedEntry(
        String title,
        String link,
        Instant publishedAt,
        String description
) {}
