package net.shelfmatch.service.scoring;

import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.model.Book;
import net.shelfmatch.service.ScoredBook;
import net.shelfmatch.service.feature.FeatureMatrix;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Scores every catalog book by its mean cosine similarity to the user's liked books, minus the
 * weighted mean similarity to disliked books.
 *
 * <p>Ranking is a stable sort on score, so equal scores keep catalog order. Liked, disliked and
 * explicitly excluded books never appear in the output.</p>
 */
@Component
@Slf4j
public class ContentScorer {

    private final double penaltyWeight;

    public ContentScorer(RecommendationProperties properties) {
        this.penaltyWeight = properties.getPenaltyWeight();
    }

    /**
     * @param catalog the current request's catalog; results carry these book instances
     * @param matrix features of the catalog, row {@code i} describing {@code catalog.get(i)}
     * @param likedIds books the user likes
     * @param dislikedIds books the user dislikes
     * @param excludedIds further ids to leave out (for example the book being viewed)
     * @param limit maximum number of results
     * @return ranked content-based results; empty when no liked book is in the catalog
     */
    public List<ScoredBook> score(List<Book> catalog,
                                  FeatureMatrix matrix,
                                  Set<Long> likedIds,
                                  Set<Long> dislikedIds,
                                  Set<Long> excludedIds,
                                  int limit) {
        requireAligned(catalog, matrix);
        if (matrix.isEmpty() || limit <= 0) {
            return List.of();
        }
        int[] likedRows = rowsOf(matrix, likedIds);
        if (likedRows.length == 0) {
            log.debug("No liked book present in the catalog; content scoring skipped");
            return List.of();
        }
        int[] dislikedRows = rowsOf(matrix, dislikedIds);

        double[] scores = new double[matrix.size()];
        for (int i = 0; i < matrix.size(); i++) {
            double score = meanSimilarity(matrix, i, likedRows);
            if (dislikedRows.length > 0) {
                score -= penaltyWeight * meanSimilarity(matrix, i, dislikedRows);
            }
            scores[i] = score;
        }

        List<Integer> order = new ArrayList<>(matrix.size());
        for (int i = 0; i < matrix.size(); i++) {
            order.add(i);
        }
        // List.sort is stable: ties keep catalog order
        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        List<ScoredBook> results = new ArrayList<>(Math.min(limit, matrix.size()));
        for (int index : order) {
            if (results.size() >= limit) {
                break;
            }
            Book book = catalog.get(index);
            if (likedIds.contains(book.id()) || dislikedIds.contains(book.id()) || excludedIds.contains(book.id())) {
                continue;
            }
            results.add(ScoredBook.contentBased(book, scores[index]));
        }
        return List.copyOf(results);
    }

    private static void requireAligned(List<Book> catalog, FeatureMatrix matrix) {
        if (catalog.size() != matrix.size()) {
            throw new IllegalArgumentException(
                "Feature matrix has " + matrix.size() + " rows but the catalog has " + catalog.size() + " books");
        }
        for (int i = 0; i < catalog.size(); i++) {
            if (catalog.get(i).id() != matrix.bookId(i)) {
                throw new IllegalArgumentException("Feature row " + i + " belongs to book " + matrix.bookId(i)
                    + " but the catalog holds book " + catalog.get(i).id());
            }
        }
    }

    private static int[] rowsOf(FeatureMatrix matrix, Set<Long> ids) {
        return ids.stream()
            .mapToInt(matrix::indexOf)
            .filter(index -> index >= 0)
            .distinct()
            .toArray();
    }

    private static double meanSimilarity(FeatureMatrix matrix, int row, int[] targets) {
        double sum = 0.0;
        for (int target : targets) {
            sum += matrix.cosine(row, target);
        }
        return sum / targets.length;
    }
}
