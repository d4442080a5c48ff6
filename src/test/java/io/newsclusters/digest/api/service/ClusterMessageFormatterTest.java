package io.newsclusters.digest.api.service;

import io.newsclusters.digest.DigestConfigFixtures;
import io.newsclusters.digest.api.dto.NewsEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class ClusterMessageFormatterTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private ClusterMessageFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ClusterMessageFormatter(DigestConfigFixtures.digestConfig());
    }

    @Test
    @DisplayName("Should report no clusters when every cluster has one article")
    void shouldReportNoClustersForSingletons() {
        Map<Integer, List<NewsEntry>> clusters = Map.of(
                0, List.of(entry("Alone", "https://a.example/1")),
                1, List.of(entry("Also alone", "https://a.example/2"))
        );

        assertThat(formatter.format(clusters)).containsExactly("No clustered news found\\.");
    }

    @Test
    @DisplayName("Should report no clusters for an empty map")
    void shouldReportNoClustersForEmptyMap() {
        assertThat(formatter.format(Map.of())).containsExactly(ClusterMessageFormatter.NO_CLUSTERS_MESSAGE);
    }

    @Test
    @DisplayName("Should escape reserved characters in the heading")
    void shouldEscapeHeading() {
        Map<Integer, List<NewsEntry>> clusters = Map.of(0, List.of(
                entry("Markets fall. Stocks dip!", "https://a.example/1"),
                entry("Stocks dip as markets fall", "https://a.example/2")
        ));

        List<String> pages = formatter.format(clusters);

        assertThat(pages).hasSize(1);
        assertThat(pages.get(0)).startsWith("*Markets fall\\. Stocks dip\\!*\n\n");
    }

    @Test
    @DisplayName("Should render articles as escaped links with their source")
    void shouldRenderArticleLinks() {
        Map<Integer, List<NewsEntry>> clusters = Map.of(0, List.of(
                new NewsEntry("Rates up 0.5%", "https://a.example/path_(1)", NOW, "The-Wire"),
                entry("Rates rise", "https://b.example/2")
        ));

        String page = formatter.format(clusters).get(0);

        assertThat(page).contains("  • [Rates up 0\\.5%](https://a.example/path_(1\\))\n    _via The\\-Wire_\n\n");
        assertThat(page).contains("  • [Rates rise](https://b.example/2)\n    _via Wire_\n\n");
        assertThat(page).endsWith("─".repeat(35) + "\n\n");
    }

    @Test
    @DisplayName("Should list larger clusters first")
    void shouldSortClustersBySize() {
        Map<Integer, List<NewsEntry>> clusters = new LinkedHashMap<>();
        clusters.put(0, List.of(entry("Small one", "https://a.example/1"), entry("Small two", "https://a.example/2")));
        clusters.put(1, List.of(entry("Big one", "https://b.example/1"), entry("Big two", "https://b.example/2"),
                entry("Big three", "https://b.example/3")));

        String page = formatter.format(clusters).get(0);

        assertThat(page.indexOf("*Big one*")).isLessThan(page.indexOf("*Small one*"));
    }

    @Test
    @DisplayName("Should note articles beyond the per-cluster limit")
    void shouldNoteHiddenArticles() {
        List<NewsEntry> articles = IntStream.range(0, 7)
                .mapToObj(i -> entry("Story " + i, "https://a.example/" + i))
                .toList();

        String page = formatter.format(Map.of(0, articles)).get(0);

        assertThat(page).contains("[Story 4]");
        assertThat(page).doesNotContain("[Story 5]");
        assertThat(page).contains("  _\\.\\.\\.and 2 more related articles_\n\n");
    }

    @Test
    @DisplayName("Should collect single articles under a mixed section")
    void shouldRenderMixedArticles() {
        Map<Integer, List<NewsEntry>> clusters = new LinkedHashMap<>();
        clusters.put(0, List.of(entry("Pair one", "https://a.example/1"), entry("Pair two", "https://a.example/2")));
        for (int i = 1; i <= 12; i++) {
            clusters.put(i, List.of(entry("Single " + i, "https://s.example/" + i)));
        }

        String page = String.join("", formatter.format(clusters));

        assertThat(page).contains("*Mixed Articles*\n\n");
        assertThat(page).contains("[Single 10]");
        assertThat(page).doesNotContain("[Single 11]");
        assertThat(page).contains("  _\\.\\.\\.and 2 more articles_\n\n");
        assertThat(page.indexOf("*Pair one*")).isLessThan(page.indexOf("*Mixed Articles*"));
    }

    @Test
    @DisplayName("Should render only the requested number of multi-article clusters")
    void shouldLimitClusterCount() {
        Map<Integer, List<NewsEntry>> clusters = new LinkedHashMap<>();
        clusters.put(0, List.of(entry("First one", "https://a.example/1"), entry("First two", "https://a.example/2")));
        clusters.put(1, List.of(entry("Second one", "https://b.example/1"), entry("Second two", "https://b.example/2")));

        String page = String.join("", formatter.format(clusters, 1));

        assertThat(page).contains("*First one*");
        assertThat(page).doesNotContain("*Second one*");
    }

    @Test
    @DisplayName("Should split output into pages within the budget without losing text")
    void shouldPaginateWithinBudget() {
        int budget = 600;
        ClusterMessageFormatter small = new ClusterMessageFormatter(
                DigestConfigFixtures.digestConfig("https://news.example/rss", budget));

        Map<Integer, List<NewsEntry>> clusters = new LinkedHashMap<>();
        List<String> expectedBlocks = new ArrayList<>();
        for (int c = 0; c < 6; c++) {
            List<NewsEntry> articles = new ArrayList<>();
            for (int a = 0; a < 3; a++) {
                articles.add(entry("Cluster " + c + " story " + a, "https://c" + c + ".example/" + a));
            }
            clusters.put(c, articles);
            expectedBlocks.add(small.renderCluster(articles));
        }

        List<String> pages = small.format(clusters);

        assertThat(pages).hasSizeGreaterThan(1);
        assertThat(pages).allSatisfy(page -> assertThat(page.length()).isLessThanOrEqualTo(budget).isPositive());
        assertThat(String.join("", pages)).isEqualTo(String.join("", expectedBlocks));
    }

    @Test
    @DisplayName("Should split a block larger than the budget without breaking escapes")
    void shouldSplitOversizedBlock() {
        int budget = 60;
        ClusterMessageFormatter.Paginator paginator = new ClusterMessageFormatter.Paginator(budget);
        String block = "a".repeat(59) + "\\." + "\n" + "b".repeat(30) + "\n";

        paginator.append(block);
        List<String> pages = paginator.finish();

        assertThat(String.join("", pages)).isEqualTo(block);
        assertThat(pages).allSatisfy(page -> {
            assertThat(page.length()).isLessThanOrEqualTo(budget);
            assertThat(page).doesNotEndWith("\\");
        });
    }

    @Test
    @DisplayName("Should reject a negative cluster limit")
    void shouldRejectNegativeClusterLimit() {
        assertThatThrownBy(() -> formatter.format(Map.of(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static NewsEntry entry(String title, String link) {
        return new NewsEntry(title, link, NOW, "Wire");
    }
}
