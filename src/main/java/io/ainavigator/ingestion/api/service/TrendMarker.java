package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.config.NewsConfig;
import io.ainavigator.ingestion.model.Article;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Recency heuristic: the N most recently created articles of a collection are trending.
 * Flags are only ever set here, never cleared.
 */
@Component
public class TrendMarker {

    private final int trendingCount;

    public TrendMarker(NewsConfig newsConfig) {
        this(newsConfig.ingestion().trendingCount());
    }

    TrendMarker(int trendingCount) {
        this.trendingCount = trendingCount;
    }

    /**
     * @return the same articles, newest first, with the first {@code trending-count} flagged
     */
    public List<Article> markTrending(Collection<Article> articles) {
        List<Article> sorted = articles.stream()
                .sorted(Comparator.comparing(Article::createdAt).reversed())
                .toList();

        List<Article> marked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Article article = sorted.get(i);
            marked.add(i < trendingCount && !article.trending() ? article.withTrending(true) : article);
        }
        return marked;
    }
}
