package io.ainavigator.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ainavigator.ingestion.model.Article;
import io.ainavigator.ingestion.model.SummaryStatus;

import java.time.Instant;

public record ArticleIngestedEvent(
        @JsonProperty("articleId") String articleId,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("sourceName") String sourceName,
        @JsonProperty("summaryStatus") SummaryStatus summaryStatus,
        @JsonProperty("publishedAt") @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
        Instant publishedAt,
        @JsonProperty("ingestedAt") @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
        Instant ingestedAt
) {
    public static ArticleIngestedEvent create(Article article) {
        return new ArticleIngestedEvent(
                article.id(), article.title(), article.url(),
                article.sourceId(), article.sourceName(), article.summaryStatus(),
                article.publishedAt(), article.createdAt()
        );
    }
}
