package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.NewsEntry;
import io.newsclusters.digest.api.service.clustering.AgglomerativeClusterer;
import io.newsclusters.digest.api.service.similarity.SimilarityEngine;
import io.newsclusters.digest.api.service.similarity.SimilarityMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class NewsClusteringService {
    private static final Logger logger = LoggerFactory.getLogger(NewsClusteringService.class);

    private final SimilarityEngine similarityEngine;
    private final AgglomerativeClusterer clusterer;

    public NewsClusteringService(SimilarityEngine similarityEngine, AgglomerativeClusterer clusterer) {
        this.similarityEngine = similarityEngine;
        this.clusterer = clusterer;
    }

    /**
     * Groups entries whose titles are similar enough into clusters.
     *
     * @param entries   deduplicated entries in fetch order
     * @param threshold similarity in (0, 1]; entries merge while average distance is below {@code 1 - threshold}
     * @return cluster id to members, ids and member order following the entries' order
     */
    public Map<Integer, List<NewsEntry>> cluster(List<NewsEntry> entries, double threshold) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Similarity threshold must be in (0, 1]: " + threshold);
        }

        if (entries.isEmpty()) {
            return Map.of();
        }
        if (entries.size() == 1) {
            return Map.of(0, List.of(entries.get(0)));
        }

        List<String> titles = entries.stream()
                .map(NewsEntry::title)
                .toList();

        long start = System.currentTimeMillis();
        SimilarityMatrix similarity = similarityEngine.similarity(titles);
        if (similarity.isEmpty()) {
            return Map.of();
        }

        int[] labels = clusterer.labels(similarity.toDistances(), 1.0 - threshold);

        Map<Integer, List<NewsEntry>> clusters = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            clusters.computeIfAbsent(labels[i], label -> new ArrayList<>()).add(entries.get(i));
        }

        logger.info("Clustered {} entries into {} clusters with {} in {}ms",
                entries.size(), clusters.size(), similarityEngine.name(), System.currentTimeMillis() - start);

        return clusters;
    }

    public String engineName() {
        return similarityEngine.name();
    }
}
