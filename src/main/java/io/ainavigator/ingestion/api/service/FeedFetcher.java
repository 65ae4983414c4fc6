package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.exception.ErrorCategory;
import io.ainavigator.ingestion.api.exception.FeedReadException;
import io.ainavigator.ingestion.config.HttpConfig;
import io.ainavigator.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

/**
 * Downloads raw feed documents. Transient failures are retried with exponential backoff,
 * everything else surfaces immediately as a categorized {@link FeedReadException}.
 */
@Component
public class FeedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(FeedFetcher.class);

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final HttpConfig http;

    public FeedFetcher(NewsConfig newsConfig) {
        this.http = newsConfig.http();
    }

    @Retryable(
            retryFor = FeedReadException.class,
            exceptionExpression = "category.isTransient()",
            maxAttemptsExpression = "#{@ingestionProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@ingestionProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    public byte[] fetch(String url) throws FeedReadException {
        if (url == null || url.isBlank()) {
            throw new FeedReadException("URL is null or empty", ErrorCategory.INVALID_URL);
        }

        HttpURLConnection connection = null;
        try {
            connection = (HttpURLConnection) URI.create(url.trim()).toURL().openConnection();
            configureConnection(connection);
            connection.connect();

            validateHttpResponse(connection, url);

            try (InputStream body = openBody(connection)) {
                return body.readAllBytes();
            }

        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new FeedReadException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedReadException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedReadException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedReadException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new FeedReadException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedReadException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(http.connectTimeout());
        connection.setReadTimeout(http.readTimeout());

        connection.setRequestProperty("User-Agent", nextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url)
            throws IOException, FeedReadException {
        int responseCode = connection.getResponseCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                String contentType = connection.getContentType();
                if (contentType != null && !isFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
                break;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new FeedReadException("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new FeedReadException("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new FeedReadException("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new FeedReadException("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new FeedReadException("Server error (500): " + url, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new FeedReadException("Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode >= 400) {
                    throw new FeedReadException(
                            String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), url),
                            ErrorCategory.HTTP_ERROR
                    );
                }
        }
    }

    private InputStream openBody(HttpURLConnection connection) throws IOException {
        InputStream inputStream = connection.getInputStream();
        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            return new GZIPInputStream(inputStream);
        }
        return inputStream;
    }

    private String nextUserAgent() {
        List<String> userAgents = http.userAgents();
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }

    private boolean isFeedContentType(String contentType) {
        String lower = contentType.toLowerCase();
        return lower.contains("xml") || lower.contains("rss") || lower.contains("atom") || lower.contains("text");
    }
}
