package io.newsclusters.digest.config;

public record ClusteringConfig(
        double similarityThreshold,
        String encoderModelPath,
        String encoderTokenizerPath
) {
    public boolean hasEncoder() {
        return encoderModelPath != null && !encoderModelPath.isBlank()
                && encoderTokenizerPath != null && !encoderTokenizerPath.isBlank();
    }
}
