package net.shelfmatch.repository;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.exception.RecommendationDataAccessException;
import net.shelfmatch.model.ActivityKind;
import net.shelfmatch.model.ActivityRecord;
import net.shelfmatch.model.UserActivity;
import net.shelfmatch.model.UserPreferences;
import net.shelfmatch.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a single user's reactions, review ratings and stored preferences.
 *
 * <p>Rows are decoded into {@link ActivityRecord} immediately; nothing positional leaves this
 * class. Like/dislike rows are partitioned by their stored {@code action} value.</p>
 */
@Repository
@Slf4j
public class UserActivityRepository {

    static final String REACTIONS_SQL = """
            SELECT l."bookId" AS book_id,
                   l.action
            FROM likes l
            JOIN books b ON b.id = l."bookId"
            WHERE l."userId" = ?
            ORDER BY l.id
            """;

    static final String RATINGS_SQL = """
            SELECT r."bookId" AS book_id,
                   r.rating
            FROM reviews r
            JOIN books b ON b.id = r."bookId"
            WHERE r."userId" = ?
              AND r.rating IS NOT NULL
            ORDER BY r.id
            """;

    static final String PREFERENCES_SQL = """
            SELECT "favoriteGenres" AS favorite_genres,
                   "favoriteAuthors" AS favorite_authors,
                   "favoriteBooks" AS favorite_books
            FROM users
            WHERE id = ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final RetryTemplate retryTemplate;

    public UserActivityRepository(@Nullable JdbcTemplate jdbcTemplate,
                                  @Qualifier("repositoryRetryTemplate") RetryTemplate retryTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.retryTemplate = retryTemplate;
    }

    public boolean isEnabled() {
        return jdbcTemplate != null;
    }

    /**
     * Fetches all recorded activity for the user.
     *
     * @param userId the user identifier (already validated by the caller)
     * @return decoded activity; empty activity when no datasource is configured
     */
    public UserActivity fetchActivity(long userId) {
        if (!isEnabled()) {
            log.debug("No datasource configured; activity for user {} is empty.", userId);
            return UserActivity.empty(userId);
        }
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    LoggingUtils.warn(log, context.getLastThrowable(), "Retrying activity read for user {} (attempt {})",
                        userId, context.getRetryCount() + 1);
                }
                return loadActivity(userId);
            });
        } catch (DataAccessException ex) {
            throw new RecommendationDataAccessException(
                "fetchActivity", "Failed to load activity for user " + userId, ex);
        }
    }

    private UserActivity loadActivity(long userId) {
        List<ActivityRecord> reactions = new ArrayList<>();
        jdbcTemplate.query(REACTIONS_SQL, ps -> ps.setLong(1, userId), rs -> {
            long bookId = rs.getLong("book_id");
            String action = rs.getString("action");
            Optional<ActivityKind> kind = ActivityKind.fromStoredValue(action);
            if (kind.isEmpty() || kind.get() == ActivityKind.RATING) {
                log.debug("Skipping non-reaction action '{}' for user {} and book {}", action, userId, bookId);
                return;
            }
            reactions.add(new ActivityRecord(userId, bookId, kind.get(), null, null));
        });

        List<ActivityRecord> ratings = jdbcTemplate.query(RATINGS_SQL, ps -> ps.setLong(1, userId),
            (rs, rowNum) -> ActivityRecord.rating(userId, rs.getLong("book_id"), rs.getDouble("rating")));

        List<UserPreferences> preferences = jdbcTemplate.query(PREFERENCES_SQL, ps -> ps.setLong(1, userId),
            CatalogRowMappers.preferencesRowMapper());

        log.debug("Loaded activity for user {}: {} reactions, {} ratings",
            userId, reactions.size(), ratings.size());
        return new UserActivity(userId, reactions, ratings, preferences.stream().findFirst());
    }
}
