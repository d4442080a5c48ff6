package io.newsclusters.digest.api.service.similarity;

import java.util.List;

/**
 * Strategy for computing pairwise similarity between headlines.
 * Implementations must return a symmetric matrix with unit diagonal and values in [0, 1].
 */
public interface SimilarityEngine {

    SimilarityMatrix similarity(List<String> titles);

    /**
     * Descriptive name of this engine (for logging and health reporting).
     */
    String name();
}
