package io.newsclusters.digest.api.service.similarity;

import java.util.List;
import java.util.Locale;

/**
 * Lexical similarity over word 1-3 gram TF-IDF vectors.
 * Captures shared wording only, so paraphrases in different words score low.
 */
public class LexicalSimilarityEngine implements SimilarityEngine {

    private final TfidfVectorizer vectorizer;

    public LexicalSimilarityEngine() {
        this(new TfidfVectorizer(1, 3, 1, 0.8));
    }

    public LexicalSimilarityEngine(TfidfVectorizer vectorizer) {
        this.vectorizer = vectorizer;
    }

    @Override
    public SimilarityMatrix similarity(List<String> titles) {
        if (titles.isEmpty()) {
            return SimilarityMatrix.empty();
        }

        List<String> documents = titles.stream()
                .map(LexicalSimilarityEngine::preprocess)
                .toList();

        return SimilarityMatrix.cosineOfNormalized(vectorizer.fitTransform(documents));
    }

    @Override
    public String name() {
        return "lexical (tf-idf word n-grams)";
    }

    static String preprocess(String title) {
        if (title == null) return "";
        return title.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }
}
