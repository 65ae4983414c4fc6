package io.ainavigator.ingestion.api.service;

public class LanguageModelException extends RuntimeException {
    public LanguageModelException(String message) {
        super(message);
    }

    public LanguageModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
