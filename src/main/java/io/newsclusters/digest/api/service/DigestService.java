package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.DigestResult;
import io.newsclusters.digest.api.dto.NewsEntry;
import io.newsclusters.digest.api.util.MarkdownV2;
import io.newsclusters.digest.config.DigestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Runs the fetch, filter, cluster and format pipeline for one request.
 */
@Service
public class DigestService {
    private static final Logger logger = LoggerFactory.getLogger(DigestService.class);

    static final String NO_ARTICLES_MESSAGE = "❌ No news articles found for your query\\.";
    static final String ANALYZING_MESSAGE = "✅ Fetched articles. Analyzing...";
    static final String ERROR_MESSAGE_PREFIX = "❌ An error occurred: ";

    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    private final NewsFetcherService fetcherService;
    private final RecencyFilterService recencyFilterService;
    private final NewsClusteringService clusteringService;
    private final ClusterMessageFormatter messageFormatter;
    private final MessagePublisherService messagePublisher;
    private final DigestConfig digestConfig;
    private final Clock clock;

    public DigestService(NewsFetcherService fetcherService,
                         RecencyFilterService recencyFilterService,
                         NewsClusteringService clusteringService,
                         ClusterMessageFormatter messageFormatter,
                         MessagePublisherService messagePublisher,
                         DigestConfig digestConfig,
                         Clock clock) {
        this.fetcherService = fetcherService;
        this.recencyFilterService = recencyFilterService;
        this.clusteringService = clusteringService;
        this.messageFormatter = messageFormatter;
        this.messagePublisher = messagePublisher;
        this.digestConfig = digestConfig;
        this.clock = clock;
    }

    /**
     * Builds the digest pages without publishing anything.
     */
    public DigestResult buildDigest(String topic, String location, String language) {
        requireTopic(topic);
        List<NewsEntry> fetched = fetcherService.fetchRecentNews(topic, location, language);
        return renderDigest(topic, location, language, fetched);
    }

    /**
     * Builds the digest and publishes status, header and pages to the chat in order.
     * Failures are reported to the chat rather than thrown.
     *
     * @return number of messages published
     */
    public int sendDigest(long chatId, String topic, String location, String language) {
        int published = 0;
        try {
            requireTopic(topic);
            logger.info("Processing digest for chat {}: topic='{}', location={}, language={}",
                    chatId, topic, location, language);

            List<NewsEntry> fetched = fetcherService.fetchRecentNews(topic, location, language);

            if (fetched.isEmpty()) {
                messagePublisher.publishMarkdown(chatId, NO_ARTICLES_MESSAGE);
                return 1;
            }

            messagePublisher.publishPlain(chatId, ANALYZING_MESSAGE);
            published++;

            DigestResult digest = renderDigest(topic, location, language, fetched);

            messagePublisher.publishMarkdown(chatId, header());
            published++;

            for (String page : digest.pages()) {
                messagePublisher.publishMarkdown(chatId, page);
                published++;
            }

            logger.info("Published {} messages for chat {} ({} clusters from {} recent articles)",
                    published, chatId, digest.clusters(), digest.recentArticles());
            return published;

        } catch (Exception e) {
            logger.error("Error processing digest for chat {}: {}", chatId, e.getMessage(), e);
            messagePublisher.publishPlain(chatId, ERROR_MESSAGE_PREFIX + e.getMessage());
            return published + 1;
        }
    }

    private DigestResult renderDigest(String topic, String location, String language, List<NewsEntry> fetched) {
        if (fetched.isEmpty()) {
            return new DigestResult(topic, location, language, 0, 0, 0,
                    List.of(ClusterMessageFormatter.NO_NEWS_MESSAGE));
        }

        List<NewsEntry> recent = recencyFilterService.filterRecent(fetched);

        Map<Integer, List<NewsEntry>> clusters =
                clusteringService.cluster(recent, digestConfig.clustering().similarityThreshold());

        List<String> pages = messageFormatter.format(clusters);

        return new DigestResult(topic, location, language, fetched.size(), recent.size(), clusters.size(), pages);
    }

    String header() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneId.of(digestConfig.schedule().zone())));
        return "🗞 *News Clusters for " + MarkdownV2.escape(HEADER_DATE.format(today)) + "*\n\n";
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
    }
}
