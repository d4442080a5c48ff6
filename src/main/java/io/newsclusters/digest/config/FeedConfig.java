package io.newsclusters.digest.config;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public record FeedConfig(
        String baseUrl,
        String defaultRegion,
        String defaultLanguage,
        Duration recencyWindow
) {
    /**
     * Builds the Google News search URL for one (location, language) combination.
     */
    public String searchUrl(String topic, String location, String language) {
        String query = URLEncoder.encode(topic.trim(), StandardCharsets.UTF_8);

        return String.format("%s?q=%s&hl=%s&gl=%s&ceid=%s:%s",
                baseUrl, query, language, location, location, language);
    }
}
