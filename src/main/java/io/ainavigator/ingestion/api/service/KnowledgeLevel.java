package io.ainavigator.ingestion.api.service;

import java.util.Arrays;

/**
 * Reader expertise. Only changes the wording of the summarization prompt.
 */
public enum KnowledgeLevel {
    BEGINNER("Beginner"),
    INTERMEDIATE("Intermediate"),
    EXPERT("Expert");

    private final String displayName;

    KnowledgeLevel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static KnowledgeLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            return INTERMEDIATE;
        }
        return Arrays.stream(values())
                .filter(level -> level.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(INTERMEDIATE);
    }
}
