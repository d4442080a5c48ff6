package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.NewsEntry;
import io.newsclusters.digest.config.DigestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class RecencyFilterService {
    private static final Logger logger = LoggerFactory.getLogger(RecencyFilterService.class);

    private final Clock clock;
    private final Duration window;

    public RecencyFilterService(Clock clock, DigestConfig digestConfig) {
        this.clock = clock;
        this.window = digestConfig.feed().recencyWindow();
    }

    /**
     * Keeps entries published strictly after now minus the recency window.
     * Entries without a publish time are treated as stale.
     */
    public List<NewsEntry> filterRecent(List<NewsEntry> entries) {
        Instant cutoff = clock.instant().minus(window);

        List<NewsEntry> recent = entries.stream()
                .filter(entry -> entry.publishedAt() != null && entry.publishedAt().isAfter(cutoff))
                .toList();

        logger.debug("Recency filter kept {} of {} entries (cutoff {})", recent.size(), entries.size(), cutoff);
        return recent;
    }
}
