package io.ainavigator.ingestion.model;

import io.ainavigator.ingestion.api.dto.FeedEntry;
import io.ainavigator.ingestion.api.dto.PageContent;
import io.ainavigator.ingestion.api.dto.SummaryResult;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted, enriched feed item. Only the ingestion cycle creates articles and only the
 * trending pass changes them afterwards.
 */
@Document(collection = "articles")
public record Article(
        @Id String id,
        String title,
        @Indexed String url,
        String sourceId,
        String sourceName,
        Instant publishedAt,
        List<String> categories,
        String summary,
        SummaryStatus summaryStatus,
        String content,
        String imageUrl,
        boolean trending,
        @Indexed Instant createdAt
) {
    public Article {
        requireText(id, "id");
        requireText(title, "title");
        requireText(url, "url");
        requireText(sourceName, "sourceName");
        if (summary == null) {
            throw new IllegalArgumentException("Article " + id + " has no summary");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Article " + id + " has no creation time");
        }
        categories = categories == null ? List.of() : List.copyOf(categories);
        summaryStatus = summaryStatus == null ? SummaryStatus.GENERATED : summaryStatus;
    }

    public static Article create(NewsSource source, FeedEntry entry, PageContent page,
                                 SummaryResult summary, Instant createdAt) {
        return new Article(
                UUID.randomUUID().toString(),
                entry.title(),
                entry.link(),
                source.id(),
                source.name(),
                entry.publishedAt(),
                List.of(), // filled in later by categorization
                summary.text(),
                summary.status(),
                page.text(),
                page.imageUrl(),
                false,
                createdAt
        );
    }

    public Article withTrending(boolean trending) {
        return new Article(id, title, url, sourceId, sourceName, publishedAt, categories,
                summary, summaryStatus, content, imageUrl, trending, createdAt);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Article field '" + field + "' must not be blank");
        }
    }
}
