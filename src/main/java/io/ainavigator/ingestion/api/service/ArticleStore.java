package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.ArticleQuery;
import io.ainavigator.ingestion.model.Article;
import io.ainavigator.ingestion.model.NewsSource;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Document store holding sources and articles.
 */
public interface ArticleStore {

    List<NewsSource> findEnabledSources();

    List<NewsSource> findAllSources();

    long countSources();

    void insertSources(List<NewsSource> sources);

    /**
     * @return {@code false} when no source has the given id
     */
    boolean setSourceEnabled(String sourceId, boolean enabled);

    /**
     * Articles created at or after {@code since}.
     */
    List<Article> findRecentArticles(Instant since);

    /**
     * Bulk insert. A failure may leave part of the batch written.
     *
     * @return number of articles written
     */
    int insertArticles(List<Article> articles);

    List<Article> findArticles(ArticleQuery query);

    Optional<Article> findArticle(String articleId);

    /**
     * Sets {@code trending = true} on the given articles.
     *
     * @return number of articles whose flag changed
     */
    long markTrending(Collection<String> articleIds);
}
