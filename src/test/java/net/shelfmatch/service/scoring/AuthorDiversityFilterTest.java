package net.shelfmatch.service.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.shelfmatch.service.ScoredBook;
import net.shelfmatch.testutil.CatalogFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AuthorDiversityFilterTest {

    private final AuthorDiversityFilter filter = new AuthorDiversityFilter(CatalogFixtures.defaultProperties());

    private static ScoredBook scored(long id, String author, double score) {
        return ScoredBook.contentBased(CatalogFixtures.book(id, "Book " + id, author, 1, 3.0), score);
    }

    private static List<Long> ids(List<ScoredBook> results) {
        return results.stream().map(ScoredBook::bookId).toList();
    }

    @ParameterizedTest
    @CsvSource({"4, 1", "6, 1", "7, 2", "10, 3", "20, 6"})
    void should_ComputeAuthorCap_When_GivenListLength(int length, int expectedCap) {
        assertThat(filter.maxPerAuthor(length)).isEqualTo(expectedCap);
    }

    @Test
    void should_ReturnListUnchanged_When_ThreeOrFewerEntries() {
        List<ScoredBook> ranked = List.of(scored(1, "Herbert", 0.9), scored(2, "Herbert", 0.8), scored(3, "Herbert", 0.7));

        assertThat(filter.diversify(ranked)).containsExactlyElementsOf(ranked);
    }

    @Test
    void should_CompareAuthorsIgnoringCaseAndWhitespace_When_Filtering() {
        List<ScoredBook> ranked = List.of(
            scored(1, "Herbert", 0.9),
            scored(2, " herbert ", 0.8),
            scored(3, "Le Guin", 0.7),
            scored(4, "HERBERT", 0.6));

        assertThat(ids(filter.diversify(ranked))).containsExactly(1L, 3L);
    }

    @Test
    void should_KeepSubsequenceWithinAuthorBound_When_ListIsLong() {
        List<ScoredBook> ranked = new ArrayList<>();
        String[] authors = {"A", "A", "B", "A", "A", "C", "B", "A", "B", "B"};
        for (int i = 0; i < authors.length; i++) {
            ranked.add(scored(i + 1, authors[i], 1.0 - i * 0.05));
        }

        List<ScoredBook> diversified = filter.diversify(ranked);

        assertThat(ids(diversified)).containsExactly(1L, 2L, 3L, 4L, 6L, 7L, 9L);
        Map<String, Integer> perAuthor = new HashMap<>();
        diversified.forEach(result -> perAuthor.merge(result.book().author().toLowerCase(Locale.ROOT), 1, Integer::sum));
        assertThat(perAuthor.values()).allMatch(count -> count <= 3);
    }
}
