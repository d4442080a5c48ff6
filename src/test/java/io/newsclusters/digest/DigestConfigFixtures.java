package io.newsclusters.digest;

import io.newsclusters.digest.config.*;

import java.time.Duration;
import java.util.List;

public final class DigestConfigFixtures {

    private DigestConfigFixtures() {
    }

    public static DigestConfig digestConfig() {
        return digestConfig("https://news.google.com/rss/search", 3900);
    }

    public static DigestConfig digestConfig(String feedBaseUrl, int messageBudget) {
        FeedConfig feed = new FeedConfig(feedBaseUrl, "US", "en", Duration.ofDays(2));
        HttpConfig http = new HttpConfig(2000, 2000, 3, 100, List.of("TestAgent"));
        ClusteringConfig clustering = new ClusteringConfig(0.5, "", "");
        FormattingConfig formatting = new FormattingConfig(messageBudget, 10, 5, 10, 120, 100, 30, 35);
        ScheduleConfig schedule = new ScheduleConfig(true, "0 0 7 * * *", "UTC");

        return new DigestConfig(feed, http, clustering, formatting, schedule);
    }
}
