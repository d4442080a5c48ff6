package io.newsclusters.digest.config;

public record FormattingConfig(
        int messageBudget,
        int maxClusters,
        int maxArticlesPerCluster,
        int maxMixedArticles,
        int headingLength,
        int titleLength,
        int sourceLength,
        int ruleWidth
) {}
