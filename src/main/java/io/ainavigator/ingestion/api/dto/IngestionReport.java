package io.ainavigator.ingestion.api.dto;

import java.time.Instant;
import java.util.List;

public record IngestionReport(
        String runId,
        Instant startedAt,
        long durationMs,
        List<SourceOutcome> sources,
        int trendingMarked,
        boolean cancelled
) {
    public int totalFetched() {
        return sources.stream().mapToInt(SourceOutcome::fetched).sum();
    }

    public int totalInserted() {
        return sources.stream().mapToInt(SourceOutcome::inserted).sum();
    }

    public long failedSources() {
        return sources.stream().filter(SourceOutcome::isFailed).count();
    }
}
