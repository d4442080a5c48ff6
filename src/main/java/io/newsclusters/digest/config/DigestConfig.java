package io.newsclusters.digest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "digest")
public record DigestConfig(
        FeedConfig feed,
        HttpConfig http,
        ClusteringConfig clustering,
        FormattingConfig formatting,
        ScheduleConfig schedule
) {}
