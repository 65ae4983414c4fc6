package io.ainavigator.ingestion.api.dto;

public record SummarizeRequest(
        String url,
        String content,
        String knowledgeLevel
) {}
