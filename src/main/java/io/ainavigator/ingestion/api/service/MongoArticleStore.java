package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.ArticleQuery;
import io.ainavigator.ingestion.model.Article;
import io.ainavigator.ingestion.model.NewsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Repository
public class MongoArticleStore implements ArticleStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoArticleStore.class);

    private static final String F_ID = "id";
    private static final String F_ENABLED = "enabled";
    private static final String F_CREATED_AT = "createdAt";
    private static final String F_PUBLISHED_AT = "publishedAt";
    private static final String F_CATEGORIES = "categories";
    private static final String F_TRENDING = "trending";

    private final MongoTemplate mongoTemplate;

    public MongoArticleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<NewsSource> findEnabledSources() {
        return mongoTemplate.find(query(where(F_ENABLED).is(true)), NewsSource.class);
    }

    @Override
    public List<NewsSource> findAllSources() {
        return mongoTemplate.findAll(NewsSource.class);
    }

    @Override
    public long countSources() {
        return mongoTemplate.count(new Query(), NewsSource.class);
    }

    @Override
    public void insertSources(List<NewsSource> sources) {
        mongoTemplate.insert(sources, NewsSource.class);
    }

    @Override
    public boolean setSourceEnabled(String sourceId, boolean enabled) {
        var result = mongoTemplate.updateFirst(
                query(where(F_ID).is(sourceId)), Update.update(F_ENABLED, enabled), NewsSource.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public List<Article> findRecentArticles(Instant since) {
        return mongoTemplate.find(query(where(F_CREATED_AT).gte(since)), Article.class);
    }

    @Override
    public int insertArticles(List<Article> articles) {
        if (articles.isEmpty()) {
            return 0;
        }
        int inserted = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, Article.class)
                .insert(articles)
                .execute()
                .getInsertedCount();
        logger.debug("Inserted {} of {} articles", inserted, articles.size());
        return inserted;
    }

    @Override
    public List<Article> findArticles(ArticleQuery articleQuery) {
        Query query = new Query();
        if (!articleQuery.categories().isEmpty()) {
            query.addCriteria(where(F_CATEGORIES).in(articleQuery.categories()));
        }
        if (articleQuery.trending() != null) {
            query.addCriteria(where(F_TRENDING).is(articleQuery.trending()));
        }
        query.with(Sort.by(Sort.Direction.DESC, F_PUBLISHED_AT))
                .skip(articleQuery.skip())
                .limit(articleQuery.limit());

        return mongoTemplate.find(query, Article.class);
    }

    @Override
    public Optional<Article> findArticle(String articleId) {
        return Optional.ofNullable(mongoTemplate.findById(articleId, Article.class));
    }

    @Override
    public long markTrending(Collection<String> articleIds) {
        if (articleIds.isEmpty()) {
            return 0;
        }
        return mongoTemplate.updateMulti(
                query(where(F_ID).in(articleIds).and(F_TRENDING).is(false)),
                Update.update(F_TRENDING, true),
                Article.class
        ).getModifiedCount();
    }
}
