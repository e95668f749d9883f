package net.shelfmatch.model;

import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A single user interaction with a catalog book.
 *
 * @param userId user that produced the interaction
 * @param bookId book the interaction refers to
 * @param kind interaction kind
 * @param ratingValue rating value, present only for {@link ActivityKind#RATING}
 * @param occurredAt when the interaction happened, when recorded
 */
public record ActivityRecord(
    long userId,
    long bookId,
    ActivityKind kind,
    @Nullable Double ratingValue,
    @Nullable Instant occurredAt
) {

    public ActivityRecord {
        Objects.requireNonNull(kind, "kind");
        if (kind != ActivityKind.RATING) {
            ratingValue = null;
        }
    }

    public static ActivityRecord like(long userId, long bookId) {
        return new ActivityRecord(userId, bookId, ActivityKind.LIKE, null, null);
    }

    public static ActivityRecord dislike(long userId, long bookId) {
        return new ActivityRecord(userId, bookId, ActivityKind.DISLIKE, null, null);
    }

    public static ActivityRecord rating(long userId, long bookId, double value) {
        return new ActivityRecord(userId, bookId, ActivityKind.RATING, value, null);
    }
}
