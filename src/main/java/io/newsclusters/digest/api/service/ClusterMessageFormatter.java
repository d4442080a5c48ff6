package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.NewsEntry;
import io.newsclusters.digest.api.util.MarkdownV2;
import io.newsclusters.digest.config.DigestConfig;
import io.newsclusters.digest.config.FormattingConfig;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Renders clusters as MarkdownV2 chat messages, each within the message budget.
 */
@Service
public class ClusterMessageFormatter {

    public static final String NO_CLUSTERS_MESSAGE = MarkdownV2.escape("No clustered news found.");
    public static final String NO_NEWS_MESSAGE = MarkdownV2.escape("No news found for your query.");

    static final String MIXED_ARTICLES_HEADING = "Mixed Articles";

    private final FormattingConfig formatting;

    public ClusterMessageFormatter(DigestConfig digestConfig) {
        this.formatting = digestConfig.formatting();
    }

    public List<String> format(Map<Integer, List<NewsEntry>> clusters) {
        return format(clusters, formatting.maxClusters());
    }

    /**
     * @param clusters    cluster id to members
     * @param maxClusters how many multi-member clusters to render
     * @return pages in delivery order, never empty
     */
    public List<String> format(Map<Integer, List<NewsEntry>> clusters, int maxClusters) {
        if (maxClusters < 0) {
            throw new IllegalArgumentException("maxClusters must not be negative: " + maxClusters);
        }

        List<List<NewsEntry>> sorted = clusters.entrySet().stream()
                .sorted(Comparator.<Map.Entry<Integer, List<NewsEntry>>>comparingInt(e -> e.getValue().size())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getValue)
                .toList();

        List<List<NewsEntry>> multiArticleClusters = sorted.stream()
                .filter(articles -> articles.size() > 1)
                .toList();
        List<NewsEntry> singleArticles = sorted.stream()
                .filter(articles -> articles.size() == 1)
                .map(articles -> articles.get(0))
                .toList();

        if (multiArticleClusters.isEmpty()) {
            return List.of(NO_CLUSTERS_MESSAGE);
        }

        Paginator paginator = new Paginator(formatting.messageBudget());

        for (List<NewsEntry> articles : multiArticleClusters.subList(0, Math.min(maxClusters, multiArticleClusters.size()))) {
            paginator.append(renderCluster(articles));
        }

        if (!singleArticles.isEmpty()) {
            paginator.append(renderMixedArticles(singleArticles));
        }

        List<String> pages = paginator.finish();
        return pages.isEmpty() ? List.of(NO_NEWS_MESSAGE) : pages;
    }

    String renderCluster(List<NewsEntry> articles) {
        String heading = MarkdownV2.truncate(articles.get(0).title(), formatting.headingLength());

        StringBuilder block = new StringBuilder();
        block.append('*').append(MarkdownV2.escape(heading)).append("*\n\n");

        int shown = Math.min(formatting.maxArticlesPerCluster(), articles.size());
        for (NewsEntry article : articles.subList(0, shown)) {
            appendArticle(block, article);
        }

        if (articles.size() > shown) {
            block.append("  _\\.\\.\\.and ").append(articles.size() - shown).append(" more related articles_\n\n");
        }

        appendRule(block);
        return block.toString();
    }

    String renderMixedArticles(List<NewsEntry> articles) {
        StringBuilder block = new StringBuilder();
        block.append('*').append(MarkdownV2.escape(MIXED_ARTICLES_HEADING)).append("*\n\n");

        int shown = Math.min(formatting.maxMixedArticles(), articles.size());
        for (NewsEntry article : articles.subList(0, shown)) {
            appendArticle(block, article);
        }

        if (articles.size() > shown) {
            block.append("  _\\.\\.\\.and ").append(articles.size() - shown).append(" more articles_\n\n");
        }

        appendRule(block);
        return block.toString();
    }

    private void appendArticle(StringBuilder block, NewsEntry article) {
        String title = MarkdownV2.escape(MarkdownV2.truncate(article.title(), formatting.titleLength()));
        String source = MarkdownV2.escape(MarkdownV2.truncate(article.source(), formatting.sourceLength()));

        // Format: • Title (linked), then the source on its own line
        block.append("  • [").append(title).append("](").append(MarkdownV2.linkTarget(article.link())).append(")\n");
        block.append("    _via ").append(source).append("_\n\n");
    }

    private void appendRule(StringBuilder block) {
        block.append("─".repeat(formatting.ruleWidth())).append("\n\n");
    }

    /**
     * Packs blocks into pages no longer than the budget.
     */
    static final class Paginator {
        private final int budget;
        private final List<String> pages = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();

        Paginator(int budget) {
            if (budget < 2) {
                throw new IllegalArgumentException("Message budget too small: " + budget);
            }
            this.budget = budget;
        }

        void append(String block) {
            if (block.length() > budget) {
                splitOversized(block).forEach(this::append);
                return;
            }
            if (current.length() + block.length() > budget) {
                flush();
            }
            current.append(block);
        }

        List<String> finish() {
            flush();
            return List.copyOf(pages);
        }

        private void flush() {
            if (current.length() > 0) {
                pages.add(current.toString());
                current.setLength(0);
            }
        }

        /**
         * Splits a block on line boundaries; lines longer than the budget are cut
         * without separating an escape backslash from its character.
         */
        private List<String> splitOversized(String block) {
            List<String> pieces = new ArrayList<>();
            StringBuilder piece = new StringBuilder();

            int lineStart = 0;
            while (lineStart < block.length()) {
                int newline = block.indexOf('\n', lineStart);
                int lineEnd = newline < 0 ? block.length() : newline + 1;
                String line = block.substring(lineStart, lineEnd);
                lineStart = lineEnd;

                if (piece.length() + line.length() > budget && piece.length() > 0) {
                    pieces.add(piece.toString());
                    piece.setLength(0);
                }
                if (line.length() <= budget) {
                    piece.append(line);
                    continue;
                }

                int start = 0;
                while (start < line.length()) {
                    int end = safeCut(line, start, Math.min(start + budget, line.length()));
                    pieces.add(line.substring(start, end));
                    start = end;
                }
            }
            if (piece.length() > 0) {
                pieces.add(piece.toString());
            }
            return pieces;
        }

        private static int safeCut(String line, int start, int end) {
            if (end >= line.length()) {
                return line.length();
            }
            if (Character.isHighSurrogate(line.charAt(end - 1))) {
                end--;
            }
            int backslashes = 0;
            for (int i = end - 1; i >= start && line.charAt(i) == '\\'; i--) {
                backslashes++;
            }
            if (backslashes % 2 == 1) {
                end--;
            }
            return end > start ? end : start + 1;
        }
    }
}
