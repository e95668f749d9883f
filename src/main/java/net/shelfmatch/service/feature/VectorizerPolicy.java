package net.shelfmatch.service.feature;

/**
 * Fixed vocabulary policy of the text vectorizer. These thresholds shape the similarity
 * geometry and are not exposed as configuration.
 */
public final class VectorizerPolicy {

    /** Terms must occur in at least this many documents. */
    public static final int MIN_DOCUMENT_FREQUENCY = 2;

    /** Terms occurring in more than this share of documents are dropped. */
    public static final double MAX_DOCUMENT_RATIO = 0.8;

    /** Vocabulary cap, keeping the terms with the highest corpus frequency. */
    public static final int MAX_FEATURES = 5000;

    /** Unigrams and adjacent-token bigrams. */
    public static final int MAX_NGRAM = 2;

    /** Tokens shorter than this are ignored. */
    public static final int MIN_TOKEN_LENGTH = 2;

    private VectorizerPolicy() {
    }
}
