package io.ainavigator.ingestion.model;

public enum SummaryStatus {
    GENERATED,
    FALLBACK
}
