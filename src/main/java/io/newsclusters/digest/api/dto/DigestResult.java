package io.newsclusters.digest.api.dto;

import java.util.List;

public record DigestResult(
        String topic,
        String location,
        String language,
        int fetchedArticles,
        int recentArticles,
        int clusters,
        List<String> pages
) {
    public boolean isEmpty() {
        return fetchedArticles == 0;
    }
}
