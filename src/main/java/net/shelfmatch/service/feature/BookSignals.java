package net.shelfmatch.service.feature;

import net.shelfmatch.model.Book;

/**
 * Sanitized numeric signals of one book.
 *
 * <p>This is the only place absent or degenerate numbers are normalized: null, NaN and negative
 * counts become 0, ratings are clamped to {@code [0, maxRating]} with NaN treated as 0. Feature
 * scaling and popularity ranking both read these values, never the raw {@link Book} fields.</p>
 *
 * @param likes sanitized like count
 * @param dislikes sanitized dislike count
 * @param averageRating sanitized average rating
 */
public record BookSignals(int likes, int dislikes, double averageRating) {

    public static BookSignals of(Book book, double maxRating) {
        return new BookSignals(
            sanitizeCount(book.likeCount()),
            sanitizeCount(book.dislikeCount()),
            sanitizeRating(book.averageRating(), maxRating)
        );
    }

    static int sanitizeCount(Integer value) {
        if (value == null || value < 0) {
            return 0;
        }
        return value;
    }

    static double sanitizeRating(Double value, double maxRating) {
        if (value == null || !Double.isFinite(value)) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), maxRating);
    }
}
