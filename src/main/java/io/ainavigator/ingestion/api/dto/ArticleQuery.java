package io.ainavigator.ingestion.api.dto;

import java.util.List;

/**
 * Read-path filter. Empty categories and a null trending flag mean "no filter".
 */
public record ArticleQuery(
        List<String> categories,
        Boolean trending,
        int skip,
        int limit
) {
    public static final int MAX_LIMIT = 100;

    public ArticleQuery {
        categories = categories == null ? List.of() : List.copyOf(categories);
        skip = Math.max(0, skip);
        limit = limit <= 0 ? 20 : Math.min(limit, MAX_LIMIT);
    }
}
