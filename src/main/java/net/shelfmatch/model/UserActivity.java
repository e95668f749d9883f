package net.shelfmatch.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything the repository knows about one user's behavior, decoded into typed records.
 *
 * @param userId the user
 * @param reactions like and dislike records
 * @param ratings review rating records
 * @param preferences stored preference fields, when the user row exists
 */
public record UserActivity(
    long userId,
    List<ActivityRecord> reactions,
    List<ActivityRecord> ratings,
    Optional<UserPreferences> preferences
) {

    public UserActivity {
        reactions = reactions == null ? List.of() : List.copyOf(reactions);
        ratings = ratings == null ? List.of() : List.copyOf(ratings);
        preferences = preferences == null ? Optional.empty() : preferences;
    }

    public static UserActivity empty(long userId) {
        return new UserActivity(userId, List.of(), List.of(), Optional.empty());
    }
}
