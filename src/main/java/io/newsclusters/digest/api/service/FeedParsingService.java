package io.newsclusters.digest.api.service;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.newsclusters.digest.api.dto.NewsEntry;
import io.newsclusters.digest.api.exception.ErrorCategory;
import io.newsclusters.digest.api.exception.FeedParsingException;
import io.newsclusters.digest.config.DigestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

@Service
public class FeedParsingService {

    private static final Logger logger = LoggerFactory.getLogger(FeedParsingService.class);

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final DigestConfig digestConfig;

    public FeedParsingService(DigestConfig digestConfig) {
        this.digestConfig = digestConfig;
    }

    /**
     * Parse a feed with retry on transient failures.
     * Permanent failures are logged and yield an empty list right away.
     *
     * @param url feed URL
     * @return list of entries (empty if parsing fails permanently)
     */
    @Retryable(
            retryFor = FeedParsingException.class,
            maxAttemptsExpression = "#{@digestProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@digestProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    public List<NewsEntry> parseFeedFromUrl(String url) throws FeedParsingException {
        try {
            logger.debug("Parsing feed from: {}", url);
            return parseFeedWithErrorHandling(url);

        } catch (FeedParsingException e) {
            if (e.getCategory().isTransient()) {
                logger.warn("Transient error for {}: {} (category: {})", url, e.getMessage(), e.getCategory());
                throw e;
            }
            return handleParsingError(url, e);
        }
    }

    @Recover
    public List<NewsEntry> recoverFromTransientFailure(FeedParsingException e, String url) {
        logger.error("Giving up on feed {} after retries: {} (category: {})", url, e.getMessage(), e.getCategory());
        return Collections.emptyList();
    }

    private List<NewsEntry> parseFeedWithErrorHandling(String url) throws FeedParsingException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.trim().isEmpty()) {
                throw new FeedParsingException("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            URL feedUrl = new URL(url);
            connection = (HttpURLConnection) feedUrl.openConnection();

            configureConnection(connection);

            connection.connect();

            validateHttpResponse(connection, url);

            return parseFeed(connection);

        } catch (FeedParsingException e) {
            throw e;

        } catch (MalformedURLException e) {
            throw new FeedParsingException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedParsingException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedParsingException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedParsingException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new FeedParsingException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedParsingException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } catch (Exception e) {
            throw new FeedParsingException("Unexpected error: " + url, e, ErrorCategory.UNKNOWN);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(digestConfig.http().connectTimeout());
        connection.setReadTimeout(digestConfig.http().readTimeout());

        // Set headers to avoid blocking
        connection.setRequestProperty("User-Agent", getNextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Encoding", "gzip, deflate");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FeedParsingException {
        int responseCode = connection.getResponseCode();
        String responseMessage = connection.getResponseMessage();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                String contentType = connection.getContentType();
                if (contentType != null && !isValidFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
                break;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new FeedParsingException("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new FeedParsingException("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new FeedParsingException("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new FeedParsingException("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new FeedParsingException("Server error (500): " + url, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new FeedParsingException("Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode >= 400) {
                    throw new FeedParsingException(
                            String.format("HTTP error %d (%s): %s", responseCode, responseMessage, url),
                            ErrorCategory.HTTP_ERROR
                    );
                }
        }
    }

    private List<NewsEntry> parseFeed(HttpURLConnection connection) throws FeedParsingException {
        try (InputStream rawStream = connection.getInputStream()) {
            InputStream inputStream = rawStream;

            if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
                inputStream = new GZIPInputStream(rawStream);
            }

            String xmlContent = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);

            SyndFeed feed = new SyndFeedInput().build(new StringReader(xmlContent));

            if (feed == null) {
                throw new FeedParsingException("Feed is null", ErrorCategory.PARSE_ERROR);
            }

            if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
                logger.debug("Feed has no entries");
                return Collections.emptyList();
            }

            return feed.getEntries().stream()
                    .map(this::convertToEntry)
                    .filter(Objects::nonNull)
                    .toList();

        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedParsingException("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw new FeedParsingException("I/O error reading feed: " + e.getMessage(), e, ErrorCategory.IO_ERROR);
        }
    }

    NewsEntry convertToEntry(SyndEntry entry) {
        if (entry == null) {
            return null;
        }

        var link = entry.getLink() != null ? entry.getLink().trim() : "";
        if (link.isBlank()) {
            logger.debug("Skipping entry without link: title='{}'", entry.getTitle());
            return null;
        }

        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        Instant publishedAt = date != null ? date.toInstant() : null;

        var title = cleanText(entry.getTitle());
        var source = entry.getSource() != null ? cleanText(entry.getSource().getTitle()) : null;

        return new NewsEntry(title, link, publishedAt, source);
    }

    private List<NewsEntry> handleParsingError(String url, FeedParsingException e) {
        switch (e.getCategory()) {
            case NOT_FOUND, ACCESS_FORBIDDEN, AUTH_REQUIRED ->
                    logger.error("Permanent error for {}: {}", url, e.getMessage());
            case PARSE_ERROR ->
                    logger.warn("Parse error for {}: {}", url, e.getMessage());
            default ->
                    logger.error("Unknown error for {}: {}", url, e.getMessage(), e);
        }
        return Collections.emptyList();
    }

    private String getNextUserAgent() {
        List<String> userAgents = digestConfig.http().userAgents();
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }

    private boolean isValidFeedContentType(String contentType) {
        String lowerContentType = contentType.toLowerCase();
        return lowerContentType.contains("xml") ||
                lowerContentType.contains("rss") ||
                lowerContentType.contains("atom") ||
                lowerContentType.contains("text");
    }

    private String cleanText(String text) {
        if (text == null) return "";

        return text
                .replaceAll("<[^>]+>", " ")     // Remove HTML tags
                .replaceAll("\\s+", " ")        // Normalize whitespace
                .trim();
    }
}
