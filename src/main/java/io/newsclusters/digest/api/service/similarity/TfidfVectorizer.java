package io.newsclusters.digest.api.service.similarity;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word n-gram TF-IDF vectorizer with smoothed idf and L2-normalised rows.
 */
public class TfidfVectorizer {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final int minN;
    private final int maxN;
    private final int minDf;
    private final double maxDf;

    /**
     * @param minN  smallest n-gram length
     * @param maxN  largest n-gram length
     * @param minDf minimum number of documents a term must occur in
     * @param maxDf maximum share of documents a term may occur in, in (0, 1]
     */
    public TfidfVectorizer(int minN, int maxN, int minDf, double maxDf) {
        if (minN < 1 || maxN < minN) {
            throw new IllegalArgumentException("Invalid n-gram range: " + minN + ".." + maxN);
        }
        if (maxDf <= 0.0 || maxDf > 1.0) {
            throw new IllegalArgumentException("maxDf must be in (0, 1]: " + maxDf);
        }
        this.minN = minN;
        this.maxN = maxN;
        this.minDf = minDf;
        this.maxDf = maxDf;
    }

    /**
     * Fits the vocabulary on the documents and returns one sparse vector per document.
     * Documents whose terms were all pruned get an empty vector.
     */
    public List<Map<String, Double>> fitTransform(List<String> documents) {
        int documentCount = documents.size();

        List<Map<String, Integer>> counts = new ArrayList<>(documentCount);
        Map<String, Integer> documentFrequency = new HashMap<>();

        for (String document : documents) {
            Map<String, Integer> termCounts = new HashMap<>();
            for (String term : ngrams(tokenize(document))) {
                termCounts.merge(term, 1, Integer::sum);
            }
            termCounts.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
            counts.add(termCounts);
        }

        double maxDocumentCount = maxDf * documentCount;
        Map<String, Double> idf = new HashMap<>();
        documentFrequency.forEach((term, df) -> {
            if (df >= minDf && df <= maxDocumentCount) {
                idf.put(term, Math.log((1.0 + documentCount) / (1.0 + df)) + 1.0);
            }
        });

        List<Map<String, Double>> vectors = new ArrayList<>(documentCount);
        for (Map<String, Integer> termCounts : counts) {
            Map<String, Double> vector = new HashMap<>();
            termCounts.forEach((term, count) -> {
                Double weight = idf.get(term);
                if (weight != null) {
                    vector.put(term, count * weight);
                }
            });
            vectors.add(normalize(vector));
        }
        return vectors;
    }

    List<String> tokenize(String document) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    List<String> ngrams(List<String> tokens) {
        List<String> terms = new ArrayList<>();
        for (int n = minN; n <= maxN; n++) {
            for (int start = 0; start + n <= tokens.size(); start++) {
                terms.add(String.join(" ", tokens.subList(start, start + n)));
            }
        }
        return terms;
    }

    private static Map<String, Double> normalize(Map<String, Double> vector) {
        double norm = Math.sqrt(vector.values().stream().mapToDouble(v -> v * v).sum());
        if (norm == 0.0) {
            return vector;
        }
        vector.replaceAll((term, value) -> value / norm);
        return vector;
    }
}
