package net.shelfmatch.service.feature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF vectorizer fitted from scratch over one catalog snapshot.
 *
 * <p>Create one instance per build; a fitted instance is never reused against another catalog.
 * Pruning follows {@link VectorizerPolicy}: terms with document frequency below the minimum or
 * above the maximum ratio are dropped, then the vocabulary is capped by total corpus frequency
 * (ties resolved by lexicographic term order). Columns are in lexicographic term order.</p>
 *
 * <p>Weights are raw term counts times the smoothed inverse document frequency
 * {@code ln((1 + N) / (1 + df)) + 1}; each row is scaled to unit L2 norm.</p>
 */
public final class TextVectorizer {

    private List<String> vocabulary = List.of();
    private boolean fitted;

    /**
     * Fits the vocabulary over the documents and returns one row per document.
     *
     * @param documents raw document text, one per book in catalog order
     * @return rows of width {@link #vocabulary()}{@code .size()}
     */
    public double[][] fitTransform(List<String> documents) {
        if (fitted) {
            throw new IllegalStateException("TextVectorizer instances are single-use");
        }
        fitted = true;

        int documentCount = documents.size();
        List<Map<String, Integer>> termCounts = new ArrayList<>(documentCount);
        Map<String, Integer> documentFrequency = new HashMap<>();
        Map<String, Long> corpusFrequency = new HashMap<>();
        for (String document : documents) {
            Map<String, Integer> counts = new HashMap<>();
            for (String term : TextNormalizer.terms(TextNormalizer.tokenize(document))) {
                counts.merge(term, 1, Integer::sum);
            }
            termCounts.add(counts);
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                documentFrequency.merge(entry.getKey(), 1, Integer::sum);
                corpusFrequency.merge(entry.getKey(), entry.getValue().longValue(), Long::sum);
            }
        }

        vocabulary = selectVocabulary(documentCount, documentFrequency, corpusFrequency);
        Map<String, Integer> column = new HashMap<>();
        double[] idf = new double[vocabulary.size()];
        for (int i = 0; i < vocabulary.size(); i++) {
            String term = vocabulary.get(i);
            column.put(term, i);
            idf[i] = Math.log((1.0 + documentCount) / (1.0 + documentFrequency.get(term))) + 1.0;
        }

        double[][] rows = new double[documentCount][vocabulary.size()];
        for (int d = 0; d < documentCount; d++) {
            for (Map.Entry<String, Integer> entry : termCounts.get(d).entrySet()) {
                Integer index = column.get(entry.getKey());
                if (index != null) {
                    rows[d][index] = entry.getValue() * idf[index];
                }
            }
            VectorMath.normalizeInPlace(rows[d]);
        }
        return rows;
    }

    /**
     * Vocabulary of the last fit, in column order.
     */
    public List<String> vocabulary() {
        return vocabulary;
    }

    static List<String> selectVocabulary(int documentCount,
                                         Map<String, Integer> documentFrequency,
                                         Map<String, Long> corpusFrequency) {
        double maxDocuments = VectorizerPolicy.MAX_DOCUMENT_RATIO * documentCount;
        List<String> candidates = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            int df = entry.getValue();
            if (df >= VectorizerPolicy.MIN_DOCUMENT_FREQUENCY && df <= maxDocuments) {
                candidates.add(entry.getKey());
            }
        }
        if (candidates.size() > VectorizerPolicy.MAX_FEATURES) {
            candidates.sort(Comparator.<String>comparingLong(corpusFrequency::get).reversed()
                .thenComparing(Comparator.naturalOrder()));
            Set<String> kept = new HashSet<>(candidates.subList(0, VectorizerPolicy.MAX_FEATURES));
            candidates.removeIf(term -> !kept.contains(term));
        }
        candidates.sort(Comparator.naturalOrder());
        return List.copyOf(candidates);
    }
}
