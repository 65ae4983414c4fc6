package io.ainavigator.ingestion.api.util;

import io.ainavigator.ingestion.config.NewsConfig;
import org.springframework.stereotype.Component;

/**
 * Flat view over {@link NewsConfig} for SpEL expressions in annotations.
 */
@Component("ingestionProps")
public class IngestionProps {
    private final int maxAttempts;
    private final long retryDelay;

    public IngestionProps(NewsConfig config) {
        this.maxAttempts = config.http().maxRetries();
        this.retryDelay = config.http().retryDelay();
    }

    // retry
    public int getMaxAttempts() { return maxAttempts; }
    public long getRetryDelay() { return retryDelay; }
}
