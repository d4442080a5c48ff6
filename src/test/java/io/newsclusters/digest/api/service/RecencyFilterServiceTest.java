package io.newsclusters.digest.api.service;

import io.newsclusters.digest.DigestConfigFixtures;
import io.newsclusters.digest.api.dto.NewsEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecencyFilterServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private RecencyFilterService service;

    @BeforeEach
    void setUp() {
        service = new RecencyFilterService(Clock.fixed(NOW, ZoneOffset.UTC), DigestConfigFixtures.digestConfig());
    }

    @Test
    @DisplayName("Should keep entries from the last two days only")
    void shouldKeepRecentEntries() {
        NewsEntry fresh = entry("Fresh", NOW.minus(Duration.ofHours(1)));
        NewsEntry stale = entry("Stale", NOW.minus(Duration.ofDays(3)));

        assertThat(service.filterRecent(List.of(fresh, stale))).containsExactly(fresh);
    }

    @Test
    @DisplayName("Should drop entries exactly at the window boundary")
    void shouldDropEntriesAtBoundary() {
        NewsEntry boundary = entry("Boundary", NOW.minus(Duration.ofDays(2)));
        NewsEntry justInside = entry("Inside", NOW.minus(Duration.ofDays(2)).plusSeconds(1));

        assertThat(service.filterRecent(List.of(boundary, justInside))).containsExactly(justInside);
    }

    @Test
    @DisplayName("Should drop entries without a publish time")
    void shouldDropUndatedEntries() {
        NewsEntry undated = entry("Undated", null);

        assertThat(service.filterRecent(List.of(undated))).isEmpty();
    }

    @Test
    @DisplayName("Should preserve input order")
    void shouldPreserveOrder() {
        NewsEntry first = entry("First", NOW.minus(Duration.ofHours(5)));
        NewsEntry second = entry("Second", NOW.minus(Duration.ofHours(1)));
        NewsEntry third = entry("Third", NOW.minus(Duration.ofHours(3)));

        assertThat(service.filterRecent(List.of(first, second, third))).containsExactly(first, second, third);
    }

    private static NewsEntry entry(String title, Instant publishedAt) {
        return new NewsEntry(title, "https://example.com/" + title, publishedAt, "Wire");
    }
}
