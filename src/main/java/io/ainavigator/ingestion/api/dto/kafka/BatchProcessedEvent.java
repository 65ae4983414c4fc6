package io.ainavigator.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ainavigator.ingestion.api.dto.IngestionReport;

import java.time.Instant;

public record BatchProcessedEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("sources") int sources,
        @JsonProperty("failedSources") int failedSources,
        @JsonProperty("totalArticles") int totalArticles,
        @JsonProperty("newArticles") int newArticles,
        @JsonProperty("trendingMarked") int trendingMarked,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("processedAt") @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
        Instant processedAt
) {
    public static BatchProcessedEvent create(IngestionReport report) {
        return new BatchProcessedEvent(
                "BATCH-" + report.runId(),
                report.sources().size(),
                (int) report.failedSources(),
                report.totalFetched(),
                report.totalInserted(),
                report.trendingMarked(),
                report.durationMs(),
                Instant.now()
        );
    }
}
