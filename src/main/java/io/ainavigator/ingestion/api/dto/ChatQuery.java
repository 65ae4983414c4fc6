package io.ainavigator.ingestion.api.dto;

public record ChatQuery(
        String query,
        String articleId,
        String context
) {}
