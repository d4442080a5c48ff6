package io.newsclusters.digest.api.service.similarity;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Semantic similarity: cosine over dense sentence embeddings.
 * The embedding model is loaded once and shared; it must be safe for concurrent use.
 */
public class SemanticSimilarityEngine implements SimilarityEngine {

    private static final Logger logger = LoggerFactory.getLogger(SemanticSimilarityEngine.class);

    private final EmbeddingModel embeddingModel;

    public SemanticSimilarityEngine(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public SimilarityMatrix similarity(List<String> titles) {
        if (titles.isEmpty()) {
            return SimilarityMatrix.empty();
        }

        // Blank titles cannot be embedded; they keep a zero vector.
        List<Integer> embeddedIndexes = new ArrayList<>();
        List<TextSegment> segments = new ArrayList<>();
        for (int i = 0; i < titles.size(); i++) {
            String title = titles.get(i);
            if (title != null && !title.isBlank()) {
                embeddedIndexes.add(i);
                segments.add(TextSegment.from(title));
            }
        }

        List<double[]> vectors = new ArrayList<>(titles.size());
        for (int i = 0; i < titles.size(); i++) {
            vectors.add(new double[0]);
        }

        if (!segments.isEmpty()) {
            logger.debug("Embedding {} titles", segments.size());
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<Embedding> embeddings = response.content();

            if (embeddings.size() != segments.size()) {
                throw new IllegalStateException(
                        "Encoder returned " + embeddings.size() + " embeddings for " + segments.size() + " titles");
            }

            int dimension = embeddings.get(0).dimension();
            for (int i = 0; i < titles.size(); i++) {
                vectors.set(i, new double[dimension]);
            }
            for (int k = 0; k < embeddings.size(); k++) {
                vectors.set(embeddedIndexes.get(k), toDoubles(embeddings.get(k).vector()));
            }
        }

        return SimilarityMatrix.cosine(vectors);
    }

    @Override
    public String name() {
        return "semantic (sentence embeddings)";
    }

    private static double[] toDoubles(float[] vector) {
        double[] result = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            result[i] = vector[i];
        }
        return result;
    }
}
