package net.shelfmatch.service;

import net.shelfmatch.model.Book;
import net.shelfmatch.model.RecommendationSource;

import java.util.Objects;

/**
 * Value object tracking a book with the score that ranked it and where the score came from.
 *
 * @param book the recommended book
 * @param score similarity score for {@link RecommendationSource#CONTENT_BASED},
 *              popularity score for {@link RecommendationSource#POPULARITY}
 * @param source provenance of the score
 */
public record ScoredBook(Book book, double score, RecommendationSource source) {

    public ScoredBook {
        Objects.requireNonNull(book, "book");
        Objects.requireNonNull(source, "source");
    }

    public long bookId() {
        return book.id();
    }

    public static ScoredBook contentBased(Book book, double score) {
        return new ScoredBook(book, score, RecommendationSource.CONTENT_BASED);
    }

    public static ScoredBook popularity(Book book, double score) {
        return new ScoredBook(book, score, RecommendationSource.POPULARITY);
    }
}
