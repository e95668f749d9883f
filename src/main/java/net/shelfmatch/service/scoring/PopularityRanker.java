package net.shelfmatch.service.scoring;

import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.model.Book;
import net.shelfmatch.service.ScoredBook;
import net.shelfmatch.service.feature.BookSignals;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Ranks books by rating-weighted popularity: {@code likes * 0.4 + averageRating * likes * 0.6}.
 *
 * <p>A book without likes scores zero whatever its rating. Equal scores keep catalog order.</p>
 */
@Component
public class PopularityRanker {

    static final double LIKE_WEIGHT = 0.4;
    static final double RATED_LIKE_WEIGHT = 0.6;

    private final double maxRating;

    public PopularityRanker(RecommendationProperties properties) {
        this.maxRating = properties.getMaxRating();
    }

    public static double popularityScore(BookSignals signals) {
        return signals.likes() * LIKE_WEIGHT + signals.averageRating() * signals.likes() * RATED_LIKE_WEIGHT;
    }

    /**
     * @param books catalog in stable order
     * @param count maximum number of results
     * @param excludedIds ids that must not be returned
     * @return the most popular books not excluded, best first
     */
    public List<ScoredBook> rank(List<Book> books, int count, Set<Long> excludedIds) {
        if (books.isEmpty() || count <= 0) {
            return List.of();
        }
        List<ScoredBook> scored = new ArrayList<>(books.size());
        for (Book book : books) {
            if (!excludedIds.contains(book.id())) {
                scored.add(ScoredBook.popularity(book, popularityScore(BookSignals.of(book, maxRating))));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredBook::score).reversed());
        return List.copyOf(scored.subList(0, Math.min(count, scored.size())));
    }
}
