package net.shelfmatch.service;

import net.shelfmatch.model.ActivityKind;
import net.shelfmatch.model.ActivityRecord;
import net.shelfmatch.model.UserActivity;
import net.shelfmatch.model.UserProfile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregates one user's activity into a {@link UserProfile}.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>like/dislike records are partitioned by their recorded kind; when a book has several,
 *   the latest wins (by timestamp when both records carry one, otherwise by position)</li>
 *   <li>ratings are averaged per book; books with a like or dislike are not listed as rated</li>
 *   <li>no like, dislike or rating record at all yields {@link Optional#empty()}, whatever the
 *   preferences</li>
 * </ul>
 */
@Component
public class UserProfileBuilder {

    public Optional<UserProfile> build(UserActivity activity) {
        if (activity == null || (activity.reactions().isEmpty() && activity.ratings().isEmpty())) {
            return Optional.empty();
        }

        Map<Long, ActivityRecord> latestReaction = new LinkedHashMap<>();
        for (ActivityRecord reaction : activity.reactions()) {
            if (reaction.kind() != ActivityKind.LIKE && reaction.kind() != ActivityKind.DISLIKE) {
                continue;
            }
            latestReaction.merge(reaction.bookId(), reaction, UserProfileBuilder::later);
        }

        Set<Long> liked = new LinkedHashSet<>();
        Set<Long> disliked = new LinkedHashSet<>();
        latestReaction.forEach((bookId, reaction) -> {
            if (reaction.kind() == ActivityKind.LIKE) {
                liked.add(bookId);
            } else {
                disliked.add(bookId);
            }
        });

        Map<Long, double[]> ratingTotals = new LinkedHashMap<>();
        for (ActivityRecord rating : activity.ratings()) {
            if (rating.kind() != ActivityKind.RATING || rating.ratingValue() == null
                || !Double.isFinite(rating.ratingValue()) || latestReaction.containsKey(rating.bookId())) {
                continue;
            }
            double[] total = ratingTotals.computeIfAbsent(rating.bookId(), id -> new double[2]);
            total[0] += rating.ratingValue();
            total[1] += 1;
        }
        Map<Long, Double> ratings = new LinkedHashMap<>();
        ratingTotals.forEach((bookId, total) -> ratings.put(bookId, total[0] / total[1]));

        if (liked.isEmpty() && disliked.isEmpty() && ratings.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new UserProfile(activity.userId(), liked, disliked, ratings, activity.preferences()));
    }

    private static ActivityRecord later(ActivityRecord existing, ActivityRecord candidate) {
        if (existing.occurredAt() != null && candidate.occurredAt() != null
            && candidate.occurredAt().isBefore(existing.occurredAt())) {
            return existing;
        }
        return candidate;
    }
}
