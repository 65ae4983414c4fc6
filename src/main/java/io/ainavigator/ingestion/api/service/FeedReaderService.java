package io.ainavigator.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.ainavigator.ingestion.api.dto.FeedEntry;
import io.ainavigator.ingestion.api.exception.ErrorCategory;
import io.ainavigator.ingestion.api.exception.FeedReadException;
import io.ainavigator.ingestion.config.NewsConfig;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;

@Service
public class FeedReaderService {

    private static final Logger logger = LoggerFactory.getLogger(FeedReaderService.class);

    static final String UNTITLED = "No title";

    private final FeedFetcher feedFetcher;
    private final int maxEntries;

    public FeedReaderService(FeedFetcher feedFetcher, NewsConfig newsConfig) {
        this.feedFetcher = feedFetcher;
        this.maxEntries = newsConfig.ingestion().maxEntriesPerFeed();
    }

    /**
     * Reads the first {@code max-entries-per-feed} entries in feed order and drops those without a link.
     *
     * @param feedUrl RSS or Atom feed URL
     * @return candidate entries (empty if the feed cannot be fetched or parsed)
     */
    public List<FeedEntry> readFeed(String feedUrl) {
        try {
            logger.debug("Reading feed: {}", feedUrl);
            return toEntries(parse(feedFetcher.fetch(feedUrl)));

        } catch (FeedReadException e) {
            return handleReadError(feedUrl, e);

        } catch (Exception e) {
            logger.error("Unexpected error reading feed {}: {}", feedUrl, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    private SyndFeed parse(byte[] document) throws FeedReadException {
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(document))) {
            SyndFeed feed = new SyndFeedInput().build(reader);
            if (feed == null) {
                throw new FeedReadException("Feed is null", ErrorCategory.PARSE_ERROR);
            }
            return feed;

        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedReadException("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw new FeedReadException("I/O error reading feed: " + e.getMessage(), e, ErrorCategory.IO_ERROR);
        }
    }

    private List<FeedEntry> toEntries(SyndFeed feed) {
        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed has no entries");
            return Collections.emptyList();
        }

        return feed.getEntries().stream()
                .limit(maxEntries)
                .map(this::toEntry)
                .filter(Objects::nonNull)
                .toList();
    }

    private FeedEntry toEntry(SyndEntry entry) {
        if (entry == null) {
            return null;
        }

        var link = entry.getLink() != null ? entry.getLink().trim() : "";
        if (link.isEmpty()) {
            logger.debug("Skipping feed entry without link: '{}'", entry.getTitle());
            return null;
        }

        var title = entry.getTitle() != null ? cleanText(entry.getTitle()) : "";

        return new FeedEntry(
                title.isEmpty() ? UNTITLED : title,
                link,
                publishedAt(entry),
                description(entry)
        );
    }

    private Instant publishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    private String description(SyndEntry entry) {
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return cleanText(entry.getDescription().getValue());
        }
        return entry.getContents().stream()
                .map(SyndContent::getValue)
                .filter(Objects::nonNull)
                .map(this::cleanText)
                .filter(text -> !text.isEmpty())
                .findFirst()
                .orElse("");
    }

    private List<FeedEntry> handleReadError(String url, FeedReadException e) {
        switch (e.getCategory()) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED ->
                    logger.warn("Temporary error for {}: {}", url, e.getMessage());
            case NOT_FOUND, ACCESS_FORBIDDEN, AUTH_REQUIRED, INVALID_URL, DNS_ERROR ->
                    logger.error("Permanent error for {}: {}", url, e.getMessage());
            case PARSE_ERROR -> logger.warn("Parse error for {}: {}", url, e.getMessage());
            default -> logger.error("Failed to read feed {}: {} (category: {})", url, e.getMessage(), e.getCategory());
        }
        return Collections.emptyList();
    }

    private String cleanText(String text) {
        return Jsoup.parse(text).text().trim();
    }
}
