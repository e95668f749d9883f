package net.shelfmatch.service.feature;

import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.model.Book;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-book feature matrix for one catalog snapshot.
 *
 * <p>The vectorizer and scaler are created per build and discarded afterwards. With the feature
 * cache enabled an identical catalog reuses the matrix built for it.</p>
 */
@Service
@Slf4j
public class FeatureBuilder {

    private final FeatureMatrixCache featureMatrixCache;
    private final double maxRating;

    public FeatureBuilder(FeatureMatrixCache featureMatrixCache, RecommendationProperties properties) {
        this.featureMatrixCache = featureMatrixCache;
        this.maxRating = properties.getMaxRating();
    }

    /**
     * @param books catalog in stable order
     * @return one row per book in the same order; empty for an empty catalog
     */
    public FeatureMatrix build(List<Book> books) {
        if (books == null || books.isEmpty()) {
            return FeatureMatrix.empty();
        }
        return featureMatrixCache.getOrBuild(books, this::buildUncached);
    }

    FeatureMatrix buildUncached(List<Book> books) {
        return buildMatrix(books, maxRating);
    }

    static FeatureMatrix buildMatrix(List<Book> books, double maxRating) {
        if (books.isEmpty()) {
            return FeatureMatrix.empty();
        }
        List<String> documents = new ArrayList<>(books.size());
        double[] likes = new double[books.size()];
        double[] ratings = new double[books.size()];
        for (int i = 0; i < books.size(); i++) {
            Book book = books.get(i);
            BookSignals signals = BookSignals.of(book, maxRating);
            documents.add(TextNormalizer.document(book));
            likes[i] = signals.likes();
            ratings[i] = signals.averageRating();
        }

        TextVectorizer vectorizer = new TextVectorizer();
        double[][] text = vectorizer.fitTransform(documents);
        double[] scaledLikes = NumericFeatureScaler.standardize(likes);
        double[] scaledRatings = NumericFeatureScaler.standardize(ratings);

        int textDimensions = vectorizer.vocabulary().size();
        double[][] rows = new double[books.size()][textDimensions + 2];
        for (int i = 0; i < books.size(); i++) {
            System.arraycopy(text[i], 0, rows[i], 0, textDimensions);
            rows[i][textDimensions] = scaledLikes[i];
            rows[i][textDimensions + 1] = scaledRatings[i];
        }
        log.debug("Built feature matrix: {} books, {} text terms", books.size(), textDimensions);
        long[] bookIds = books.stream().mapToLong(Book::id).toArray();
        return new FeatureMatrix(bookIds, rows, textDimensions);
    }
}
