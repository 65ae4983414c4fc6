package io.ainavigator.ingestion.api.dto;

public record SourceOutcome(
        String sourceId,
        String sourceName,
        int fetched,
        int inserted,
        int duplicates,
        String failure
) {
    public static SourceOutcome failed(String sourceId, String sourceName, String failure) {
        return new SourceOutcome(sourceId, sourceName, 0, 0, 0, failure);
    }

    public static SourceOutcome empty(String sourceId, String sourceName) {
        return new SourceOutcome(sourceId, sourceName, 0, 0, 0, null);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
