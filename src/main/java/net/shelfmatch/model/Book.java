package net.shelfmatch.model;

import java.util.List;

/**
 * Immutable catalog entry as read from the {@code books} table for one recommendation request.
 *
 * <p>Numeric columns stay nullable here; absent values are normalized exactly once by
 * {@link net.shelfmatch.service.feature.BookSignals} before any scoring reads them.</p>
 *
 * @param id stable catalog identifier
 * @param title book title (never blank once loaded into the catalog)
 * @param author primary author (never blank once loaded into the catalog)
 * @param description free-text description, may be null
 * @param genres genre tags in stored order, never null
 * @param cover cover reference (URL or storage key), may be null
 * @param likeCount number of likes, null when the column was null
 * @param dislikeCount number of dislikes, null when the column was null
 * @param averageRating average review rating, null when the column was null
 */
public record Book(
    long id,
    String title,
    String author,
    String description,
    List<String> genres,
    String cover,
    Integer likeCount,
    Integer dislikeCount,
    Double averageRating
) {

    public Book {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }
}
