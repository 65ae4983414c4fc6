package io.ainavigator.ingestion.config;

import io.ainavigator.ingestion.api.service.ArticleStore;
import io.ainavigator.ingestion.model.NewsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes the configured sources to the store on startup, only if it holds none yet.
 * Afterwards the store is the source of truth and only the enabled flag changes.
 */
@Component
public class SourceSeeder implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(SourceSeeder.class);

    private final ArticleStore store;
    private final NewsConfig newsConfig;

    public SourceSeeder(ArticleStore store, NewsConfig newsConfig) {
        this.store = store;
        this.newsConfig = newsConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    public int seed() {
        if (store.countSources() > 0) {
            logger.debug("Sources already present, skipping seed");
            return 0;
        }

        List<NewsSource> sources = newsConfig.sources().stream()
                .map(SourceSeed::toSource)
                .toList();

        if (sources.isEmpty()) {
            logger.warn("No news sources configured under 'news.sources'");
            return 0;
        }

        store.insertSources(sources);
        logger.info("Seeded {} news sources ({} enabled)", sources.size(), newsConfig.getEnabledSeeds().size());
        return sources.size();
    }
}
