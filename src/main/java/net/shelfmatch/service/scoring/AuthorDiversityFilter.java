package net.shelfmatch.service.scoring;

import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.service.ScoredBook;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Caps how many books by the same author a ranked list may hold.
 *
 * <p>{@code maxPerAuthor = max(1, floor(L * diversityFactor))}. Lists of three or fewer entries
 * pass through unchanged. Dropped entries are not replaced; the output is a subsequence of
 * the input.</p>
 */
@Component
public class AuthorDiversityFilter {

    static final int BYPASS_LENGTH = 3;

    private final double diversityFactor;

    public AuthorDiversityFilter(RecommendationProperties properties) {
        this.diversityFactor = properties.getDiversityFactor();
    }

    public List<ScoredBook> diversify(List<ScoredBook> ranked) {
        if (ranked.size() <= BYPASS_LENGTH) {
            return List.copyOf(ranked);
        }
        int maxPerAuthor = maxPerAuthor(ranked.size());
        Map<String, Integer> perAuthor = new HashMap<>();
        List<ScoredBook> kept = new ArrayList<>(ranked.size());
        for (ScoredBook candidate : ranked) {
            String author = authorKey(candidate.book().author());
            int count = perAuthor.getOrDefault(author, 0);
            if (count < maxPerAuthor) {
                perAuthor.put(author, count + 1);
                kept.add(candidate);
            }
        }
        return List.copyOf(kept);
    }

    int maxPerAuthor(int listLength) {
        return Math.max(1, (int) Math.floor(listLength * diversityFactor));
    }

    static String authorKey(String author) {
        return author == null ? "" : author.trim().toLowerCase(Locale.ROOT);
    }
}
