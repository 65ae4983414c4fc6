package io.ainavigator.ingestion.api.exception;

public class FeedReadException extends Exception {
    private final ErrorCategory category;

    public FeedReadException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public FeedReadException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
