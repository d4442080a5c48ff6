package io.newsclusters.digest.api.dto;

import java.time.Instant;

public record NewsEntry(
        String title,
        String link,
        Instant publishedAt,
        String source
) {
    public static final String UNKNOWN_SOURCE = "Unknown";

    public NewsEntry {
        title = title != null ? title : "";
        link = link != null ? link.trim() : "";
        source = source != null && !source.isBlank() ? source : UNKNOWN_SOURCE;
    }
}
