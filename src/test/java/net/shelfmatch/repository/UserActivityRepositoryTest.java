package net.shelfmatch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import net.shelfmatch.config.RetryConfig;
import net.shelfmatch.exception.RecommendationDataAccessException;
import net.shelfmatch.model.ActivityKind;
import net.shelfmatch.model.ActivityRecord;
import net.shelfmatch.model.UserActivity;
import net.shelfmatch.model.UserPreferences;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.retry.support.RetryTemplate;

/**
 * Unit tests for activity decoding in {@link UserActivityRepository}.
 */
class UserActivityRepositoryTest {

    private static final long USER = 11L;

    private final RetryTemplate retryTemplate = RetryConfig.repositoryRetryTemplate(3, 1, 2.0, 2);

    private static void stubReactions(JdbcTemplate jdbcTemplate, Object[]... rows) throws SQLException {
        List<ResultSet> resultSets = new ArrayList<>();
        for (Object[] row : rows) {
            ResultSet rs = mock(ResultSet.class);
            when(rs.getLong("book_id")).thenReturn((Long) row[0]);
            when(rs.getString("action")).thenReturn((String) row[1]);
            resultSets.add(rs);
        }
        doAnswer(invocation -> {
            RowCallbackHandler handler = invocation.getArgument(2);
            for (ResultSet rs : resultSets) {
                handler.processRow(rs);
            }
            return null;
        }).when(jdbcTemplate).query(eq(UserActivityRepository.REACTIONS_SQL),
            any(PreparedStatementSetter.class), any(RowCallbackHandler.class));
    }

    private static void stubRatingsAndPreferences(JdbcTemplate jdbcTemplate,
                                                  List<ActivityRecord> ratings,
                                                  List<UserPreferences> preferences) {
        when(jdbcTemplate.query(eq(UserActivityRepository.RATINGS_SQL), any(PreparedStatementSetter.class),
            ArgumentMatchers.<RowMapper<ActivityRecord>>any())).thenReturn(ratings);
        when(jdbcTemplate.query(eq(UserActivityRepository.PREFERENCES_SQL), any(PreparedStatementSetter.class),
            ArgumentMatchers.<RowMapper<UserPreferences>>any())).thenReturn(preferences);
    }

    @Test
    void should_ReturnEmptyActivity_When_NoDatasourceConfigured() {
        UserActivityRepository repository = new UserActivityRepository(null, retryTemplate);

        assertThat(repository.isEnabled()).isFalse();
        assertThat(repository.fetchActivity(USER)).isEqualTo(UserActivity.empty(USER));
    }

    @Test
    void should_PartitionActionsAndSkipUnknownOnes_When_DecodingReactions() throws SQLException {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        stubReactions(jdbcTemplate,
            new Object[] {1L, "like"},
            new Object[] {2L, "DISLIKE"},
            new Object[] {3L, "bookmark"},
            new Object[] {4L, "download"},
            new Object[] {6L, "rating"});
        UserPreferences preferences = new UserPreferences("Sci-Fi", "Herbert", "Dune");
        stubRatingsAndPreferences(jdbcTemplate, List.of(ActivityRecord.rating(USER, 5L, 4.0)), List.of(preferences));

        UserActivity activity = new UserActivityRepository(jdbcTemplate, retryTemplate).fetchActivity(USER);

        assertThat(activity.reactions()).extracting(ActivityRecord::bookId, ActivityRecord::kind)
            .containsExactly(
                tuple(1L, ActivityKind.LIKE),
                tuple(2L, ActivityKind.DISLIKE));
        assertThat(activity.ratings()).extracting(ActivityRecord::ratingValue).containsExactly(4.0);
        assertThat(activity.preferences()).contains(preferences);
    }

    @Test
    void should_ReturnNoPreferences_When_UserRowMissing() throws SQLException {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        stubReactions(jdbcTemplate);
        stubRatingsAndPreferences(jdbcTemplate, List.of(), List.of());

        UserActivity activity = new UserActivityRepository(jdbcTemplate, retryTemplate).fetchActivity(USER);

        assertThat(activity.preferences()).isEmpty();
        assertThat(activity.reactions()).isEmpty();
    }

    @Test
    void should_RetryWholeRead_When_LockCannotBeAcquired() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        doThrow(new CannotAcquireLockException("lock timeout"))
            .doAnswer(invocation -> null)
            .when(jdbcTemplate).query(eq(UserActivityRepository.REACTIONS_SQL),
                any(PreparedStatementSetter.class), any(RowCallbackHandler.class));
        stubRatingsAndPreferences(jdbcTemplate, List.of(), List.of());

        UserActivity activity = new UserActivityRepository(jdbcTemplate, retryTemplate).fetchActivity(USER);

        assertThat(activity.userId()).isEqualTo(USER);
        verify(jdbcTemplate, times(2)).query(eq(UserActivityRepository.REACTIONS_SQL),
            any(PreparedStatementSetter.class), any(RowCallbackHandler.class));
    }

    @Test
    void should_WrapFailure_When_DatabaseUnavailable() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        doThrow(new DataAccessResourceFailureException("connection refused"))
            .when(jdbcTemplate).query(eq(UserActivityRepository.REACTIONS_SQL),
                any(PreparedStatementSetter.class), any(RowCallbackHandler.class));

        UserActivityRepository repository = new UserActivityRepository(jdbcTemplate, retryTemplate);

        assertThatThrownBy(() -> repository.fetchActivity(USER))
            .isInstanceOf(RecommendationDataAccessException.class)
            .hasMessageContaining(String.valueOf(USER));
    }
}
