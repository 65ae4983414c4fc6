package io.ainavigator.ingestion.api.dto;

import io.ainavigator.ingestion.model.SummaryStatus;

public record SummaryResult(
        String text,
        SummaryStatus status
) {
    public static final String FALLBACK_TEXT = "An error occurred during summarization.";

    public static SummaryResult generated(String text) {
        return new SummaryResult(text, SummaryStatus.GENERATED);
    }

    public static SummaryResult fallback() {
        return new SummaryResult(FALLBACK_TEXT, SummaryStatus.FALLBACK);
    }

    public boolean isFallback() {
        return status == SummaryStatus.FALLBACK;
    }
}
