package net.shelfmatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-request aggregation of a user's signals.
 *
 * <p>The liked, disliked and rated sets are disjoint: a book with a like or dislike reaction is
 * never also listed as rated. Sets keep first-seen order.</p>
 *
 * @param userId the user
 * @param likedIds books the user currently likes
 * @param dislikedIds books the user currently dislikes
 * @param ratings mean rating per rated book that has no like/dislike reaction
 * @param preferences stored free-text preferences, passed through unmodified
 */
public record UserProfile(
    long userId,
    Set<Long> likedIds,
    Set<Long> dislikedIds,
    Map<Long, Double> ratings,
    Optional<UserPreferences> preferences
) {

    public UserProfile {
        likedIds = Collections.unmodifiableSet(new LinkedHashSet<>(likedIds));
        dislikedIds = Collections.unmodifiableSet(new LinkedHashSet<>(dislikedIds));
        ratings = Collections.unmodifiableMap(new LinkedHashMap<>(ratings));
        preferences = preferences == null ? Optional.empty() : preferences;
    }

    public Set<Long> ratedIds() {
        return ratings.keySet();
    }

    /**
     * Identifiers that must never be recommended back to this user.
     */
    public Set<Long> interactedIds() {
        Set<Long> interacted = new LinkedHashSet<>(likedIds);
        interacted.addAll(dislikedIds);
        return Collections.unmodifiableSet(interacted);
    }
}
