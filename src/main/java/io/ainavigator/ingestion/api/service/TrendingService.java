package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.model.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the {@link TrendMarker} over recent articles and writes back the flags it set.
 */
@Service
public class TrendingService {

    private static final Logger logger = LoggerFactory.getLogger(TrendingService.class);

    private final ArticleStore store;
    private final TrendMarker trendMarker;

    public TrendingService(ArticleStore store, TrendMarker trendMarker) {
        this.store = store;
        this.trendMarker = trendMarker;
    }

    /**
     * @return number of articles newly flagged as trending
     */
    public long refreshTrending(Instant since) {
        List<Article> recent = store.findRecentArticles(since);
        if (recent.isEmpty()) {
            return 0;
        }

        Map<String, Article> before = recent.stream()
                .collect(Collectors.toMap(Article::id, Function.identity(), (a, b) -> a));

        List<String> newlyTrending = trendMarker.markTrending(recent).stream()
                .filter(Article::trending)
                .filter(article -> !before.get(article.id()).trending())
                .map(Article::id)
                .toList();

        if (newlyTrending.isEmpty()) {
            return 0;
        }

        long updated = store.markTrending(newlyTrending);
        logger.info("Marked {} articles as trending", updated);
        return updated;
    }
}
