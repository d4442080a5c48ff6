package io.newsclusters.digest.config;

import dev.langchain4j.model.embedding.onnx.OnnxEmbeddingModel;
import dev.langchain4j.model.embedding.onnx.PoolingMode;
import io.newsclusters.digest.api.service.similarity.LexicalSimilarityEngine;
import io.newsclusters.digest.api.service.similarity.SemanticSimilarityEngine;
import io.newsclusters.digest.api.service.similarity.SimilarityEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Picks the similarity engine once at startup. The sentence encoder is used when its
 * ONNX model and tokenizer are configured and load; otherwise headlines are compared lexically.
 */
@Configuration
public class SimilarityEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityEngineConfig.class);

    @Bean
    public SimilarityEngine similarityEngine(DigestConfig digestConfig) {
        ClusteringConfig clustering = digestConfig.clustering();

        if (clustering == null || !clustering.hasEncoder()) {
            logger.info("No sentence encoder configured, using lexical similarity");
            return new LexicalSimilarityEngine();
        }

        Path modelPath = Path.of(clustering.encoderModelPath());
        Path tokenizerPath = Path.of(clustering.encoderTokenizerPath());

        if (!Files.isReadable(modelPath) || !Files.isReadable(tokenizerPath)) {
            logger.warn("Sentence encoder files not readable ({}, {}), using lexical similarity",
                    modelPath, tokenizerPath);
            return new LexicalSimilarityEngine();
        }

        try {
            long start = System.currentTimeMillis();
            var embeddingModel = new OnnxEmbeddingModel(modelPath, tokenizerPath, PoolingMode.MEAN);
            logger.info("Loaded sentence encoder from {} in {}ms", modelPath, System.currentTimeMillis() - start);
            return new SemanticSimilarityEngine(embeddingModel);

        } catch (RuntimeException e) {
            logger.warn("Failed to load sentence encoder from {}: {}. Using lexical similarity",
                    modelPath, e.getMessage());
            return new LexicalSimilarityEngine();
        }
    }
}
