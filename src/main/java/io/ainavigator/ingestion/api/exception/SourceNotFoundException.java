package io.ainavigator.ingestion.api.exception;

public class SourceNotFoundException extends RuntimeException {
    public SourceNotFoundException(String sourceId) {
        super("Source not found: " + sourceId);
    }
}
