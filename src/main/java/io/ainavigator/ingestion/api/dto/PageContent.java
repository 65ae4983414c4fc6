package io.ainavigator.ingestion.api.dto;

/**
 * Text and lead image pulled from an article page. {@link Origin} tells whether the text
 * really came from the page or is a stand-in.
 */
public record PageContent(
        String text,
        String imageUrl,
        Origin origin
) {
    public static final String NO_CONTENT = "No content available";

    public enum Origin {
        PAGE,
        FEED_DESCRIPTION,
        PLACEHOLDER
    }

    public static PageContent fromPage(String text, String imageUrl) {
        return new PageContent(text, imageUrl, Origin.PAGE);
    }

    public static PageContent fallback(String feedDescription) {
        if (feedDescription == null || feedDescription.isBlank()) {
            return new PageContent(NO_CONTENT, null, Origin.PLACEHOLDER);
        }
        return new PageContent(feedDescription, null, Origin.FEED_DESCRIPTION);
    }

    public boolean isDegraded() {
        return origin != Origin.PAGE;
    }
}
