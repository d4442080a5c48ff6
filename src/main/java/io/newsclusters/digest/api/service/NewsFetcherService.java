package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.NewsEntry;
import io.newsclusters.digest.config.DigestConfig;
import io.newsclusters.digest.config.FeedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class NewsFetcherService {
    private static final Logger logger = LoggerFactory.getLogger(NewsFetcherService.class);

    private final FeedParsingService feedParsingService;
    private final DigestConfig digestConfig;

    public NewsFetcherService(FeedParsingService feedParsingService, DigestConfig digestConfig) {
        this.feedParsingService = feedParsingService;
        this.digestConfig = digestConfig;
    }

    /**
     * Queries the topic for the requested locale and two fallbacks, merging results
     * in query order. The first entry seen for a link wins.
     */
    public List<NewsEntry> fetchRecentNews(String topic, String location, String language) {
        FeedConfig feed = digestConfig.feed();
        Map<String, NewsEntry> entriesByLink = new LinkedHashMap<>();

        int failedQueries = 0;
        List<Locale> locales = queryLocales(location, language);

        for (Locale locale : locales) {
            String url = feed.searchUrl(topic, locale.location(), locale.language());
            try {
                List<NewsEntry> entries = feedParsingService.parseFeedFromUrl(url);

                for (NewsEntry entry : entries) {
                    if (!entry.link().isBlank()) {
                        entriesByLink.putIfAbsent(entry.link(), entry);
                    }
                }

                logger.debug("Query {}:{} for '{}' returned {} entries",
                        locale.location(), locale.language(), topic, entries.size());

            } catch (Exception e) {
                failedQueries++;
                logger.warn("Query {}:{} for '{}' failed: {}",
                        locale.location(), locale.language(), topic, e.getMessage());
            }
        }

        if (failedQueries == locales.size()) {
            logger.warn("All {} feed queries failed for topic '{}'", locales.size(), topic);
        }

        logger.info("Fetched {} distinct entries for '{}' ({}:{})",
                entriesByLink.size(), topic, location, language);

        return new ArrayList<>(entriesByLink.values());
    }

    List<Locale> queryLocales(String location, String language) {
        FeedConfig feed = digestConfig.feed();
        return List.of(
                new Locale(location, language),
                new Locale(feed.defaultRegion(), language),
                new Locale(location, feed.defaultLanguage())
        );
    }

    record Locale(String location, String language) {}
}
