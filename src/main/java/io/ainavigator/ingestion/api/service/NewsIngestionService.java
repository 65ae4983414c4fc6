package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.FeedEntry;
import io.ainavigator.ingestion.api.dto.IngestionReport;
import io.ainavigator.ingestion.api.dto.PageContent;
import io.ainavigator.ingestion.api.dto.SourceOutcome;
import io.ainavigator.ingestion.api.dto.SummaryResult;
import io.ainavigator.ingestion.config.IngestionSettings;
import io.ainavigator.ingestion.config.NewsConfig;
import io.ainavigator.ingestion.model.Article;
import io.ainavigator.ingestion.model.NewsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * One ingestion cycle: every enabled source with a feed is read, each entry is enriched
 * with page content and a summary, and entries not seen within the dedup window are stored.
 * <p>
 * Sources run in parallel on the ingestion executor and fail independently. The
 * dedup snapshot and the insert that follows it run under a single lock, so two sources
 * of the same cycle cannot both store the same article.
 */
@Service
public class NewsIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(NewsIngestionService.class);

    static final String CANCELLED = "cancelled";

    private final ArticleStore store;
    private final FeedReaderService feedReader;
    private final HtmlExtractorService htmlExtractor;
    private final SummarizerService summarizer;
    private final TrendingService trendingService;
    private final EventPublisherService eventPublisher;
    private final Executor executor;
    private final IngestionSettings settings;
    private final Clock clock;

    private final ReentrantLock persistLock = new ReentrantLock();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile IngestionReport lastReport;

    public NewsIngestionService(ArticleStore store,
                                FeedReaderService feedReader,
                                HtmlExtractorService htmlExtractor,
                                SummarizerService summarizer,
                                TrendingService trendingService,
                                EventPublisherService eventPublisher,
                                @Qualifier("ingestionExecutor") Executor executor,
                                NewsConfig newsConfig,
                                Clock clock) {
        this.store = store;
        this.feedReader = feedReader;
        this.htmlExtractor = htmlExtractor;
        this.summarizer = summarizer;
        this.trendingService = trendingService;
        this.eventPublisher = eventPublisher;
        this.executor = executor;
        this.settings = newsConfig.ingestion();
        this.clock = clock;
    }

    /**
     * Never throws. Returns after every enabled source has been attempted.
     */
    public IngestionReport runIngestionCycle() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = clock.instant();
        long startTime = System.currentTimeMillis();

        List<SourceOutcome> outcomes = List.of();
        long trendingMarked = 0;

        try {
            List<NewsSource> sources = store.findEnabledSources().stream()
                    .filter(source -> {
                        if (!source.hasFeed()) {
                            logger.debug("Skipping source without feed URL: {}", source.name());
                        }
                        return source.hasFeed();
                    })
                    .toList();

            logger.info("Starting ingestion cycle {} for {} sources", runId, sources.size());

            List<CompletableFuture<SourceOutcome>> pending = sources.stream()
                    .map(this::submit)
                    .toList();

            outcomes = pending.stream()
                    .map(CompletableFuture::join)
                    .toList();

            if (!isCancelled()) {
                trendingMarked = refreshTrending(startedAt);
            }

        } catch (Exception e) {
            logger.error("Ingestion cycle {} aborted: {}", runId, e.getMessage(), e);
        }

        IngestionReport report = new IngestionReport(
                runId, startedAt, System.currentTimeMillis() - startTime,
                outcomes, (int) trendingMarked, isCancelled()
        );
        lastReport = report;

        if (!report.cancelled()) {
            eventPublisher.publishBatchProcessed(report);
        }

        logger.info("Ingestion cycle {} completed: {} fetched, {} new articles, {} failed sources in {}ms",
                runId, report.totalFetched(), report.totalInserted(), report.failedSources(), report.durationMs());

        return report;
    }

    /**
     * Stops further work: sources not yet started are skipped, entries not yet enriched are
     * dropped and nothing more is written. Used on shutdown; stays in effect until {@link #resume()}.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("Ingestion cancelled, in-flight articles will be abandoned");
        }
    }

    /**
     * Lifts an earlier {@link #cancel()} so the service can run again after a restart.
     */
    public void resume() {
        if (cancelled.compareAndSet(true, false)) {
            logger.info("Ingestion resumed");
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public Optional<IngestionReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    private CompletableFuture<SourceOutcome> submit(NewsSource source) {
        try {
            return CompletableFuture.supplyAsync(() -> ingestSource(source), executor);
        } catch (Exception e) {
            logger.error("Could not schedule source {}: {}", source.name(), e.getMessage());
            return CompletableFuture.completedFuture(SourceOutcome.failed(source.id(), source.name(), e.getMessage()));
        }
    }

    SourceOutcome ingestSource(NewsSource source) {
        try {
            if (isCancelled()) {
                return SourceOutcome.failed(source.id(), source.name(), CANCELLED);
            }

            logger.info("Ingesting from source: {} ({})", source.name(), source.feedUrl());

            List<FeedEntry> entries = feedReader.readFeed(source.feedUrl());
            if (entries.isEmpty()) {
                logger.info("No feed entries from {}", source.name());
                return SourceOutcome.empty(source.id(), source.name());
            }

            List<Article> candidates = new ArrayList<>(entries.size());
            for (FeedEntry entry : entries) {
                if (isCancelled()) {
                    logger.info("Abandoning {} after {} of {} entries", source.name(), candidates.size(), entries.size());
                    return SourceOutcome.failed(source.id(), source.name(), CANCELLED);
                }
                candidates.add(enrich(source, entry));
            }

            return persistNew(source, candidates);

        } catch (Exception e) {
            logger.error("Failed to ingest from {}: {}", source.name(), e.getMessage(), e);
            return SourceOutcome.failed(source.id(), source.name(), e.getMessage());
        }
    }

    private Article enrich(NewsSource source, FeedEntry entry) {
        PageContent page = htmlExtractor.extract(entry.link(), entry.description());
        SummaryResult summary = summarizer.summarize(page.text(), settings.defaultKnowledgeLevel());

        if (page.isDegraded() || summary.isFallback()) {
            logger.debug("Degraded article {} (content: {}, summary: {})",
                    entry.link(), page.origin(), summary.status());
        }

        return Article.create(source, entry, page, summary, clock.instant());
    }

    private SourceOutcome persistNew(NewsSource source, List<Article> candidates) {
        List<Article> fresh = new ArrayList<>();
        int inserted;

        persistLock.lock();
        try {
            if (isCancelled()) {
                return SourceOutcome.failed(source.id(), source.name(), CANCELLED);
            }

            List<Article> existing = store.findRecentArticles(clock.instant().minus(settings.dedupWindow()));
            Set<String> seenUrls = existing.stream().map(Article::url).collect(Collectors.toCollection(HashSet::new));
            Set<String> seenTitles = existing.stream().map(Article::title).collect(Collectors.toCollection(HashSet::new));

            for (Article article : candidates) {
                if (seenUrls.contains(article.url()) || seenTitles.contains(article.title())) {
                    continue;
                }
                seenUrls.add(article.url());
                seenTitles.add(article.title());
                fresh.add(article);
            }

            inserted = fresh.isEmpty() ? 0 : store.insertArticles(fresh);
        } finally {
            persistLock.unlock();
        }

        int duplicates = candidates.size() - fresh.size();

        if (fresh.isEmpty()) {
            logger.info("No new articles from {}", source.name());
        } else {
            // publishing can block on the broker, keep it out of the dedup lock
            fresh.forEach(eventPublisher::publishArticleIngested);
            logger.info("Added {} new articles from {} ({} duplicates skipped)", inserted, source.name(), duplicates);
        }

        return new SourceOutcome(source.id(), source.name(), candidates.size(), inserted, duplicates, null);
    }

    private long refreshTrending(Instant now) {
        try {
            return trendingService.refreshTrending(now.minus(settings.dedupWindow()));
        } catch (Exception e) {
            logger.error("Trending refresh failed: {}", e.getMessage());
            return 0;
        }
    }
}
