package io.ainavigator.ingestion.api.service;

/**
 * Text-in, text-out access to a hosted language model.
 */
public interface LanguageModelClient {

    /**
     * @throws LanguageModelException when the call fails or yields no text
     */
    String generate(String prompt);
}
