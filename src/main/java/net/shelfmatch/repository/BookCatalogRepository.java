package net.shelfmatch.repository;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.exception.RecommendationDataAccessException;
import net.shelfmatch.model.Book;
import net.shelfmatch.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-only access to the {@code books} table.
 *
 * <p>Only rows with a non-blank title and author are handed to the recommendation core.
 * Transient failures are retried here; anything else surfaces as
 * {@link RecommendationDataAccessException}.</p>
 */
@Repository
@Slf4j
public class BookCatalogRepository {

    static final String LIST_BOOKS_SQL = """
            SELECT id,
                   title,
                   author,
                   description,
                   genres,
                   cover,
                   likes,
                   dislikes,
                   averagerating AS average_rating
            FROM books
            WHERE title IS NOT NULL
              AND author IS NOT NULL
              AND btrim(title) <> ''
              AND btrim(author) <> ''
            ORDER BY id
            """;

    private final JdbcTemplate jdbcTemplate;
    private final RetryTemplate retryTemplate;

    public BookCatalogRepository(@Nullable JdbcTemplate jdbcTemplate,
                                 @Qualifier("repositoryRetryTemplate") RetryTemplate retryTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.retryTemplate = retryTemplate;
    }

    /**
     * Indicates whether persistence is available (i.e., {@link JdbcTemplate} is configured).
     */
    public boolean isEnabled() {
        return jdbcTemplate != null;
    }

    /**
     * Lists every recommendable book in stable id order.
     *
     * @return the current catalog snapshot, empty when no datasource is configured
     */
    public List<Book> listBooks() {
        if (!isEnabled()) {
            log.debug("No datasource configured; catalog is empty.");
            return List.of();
        }
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    LoggingUtils.warn(log, context.getLastThrowable(), "Retrying catalog read (attempt {})",
                        context.getRetryCount() + 1);
                }
                return jdbcTemplate.query(LIST_BOOKS_SQL, CatalogRowMappers.bookRowMapper());
            });
        } catch (DataAccessException ex) {
            throw new RecommendationDataAccessException("listBooks", "Failed to load book catalog", ex);
        }
    }
}
