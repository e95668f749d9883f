package net.shelfmatch.repository;

import net.shelfmatch.model.Book;
import net.shelfmatch.model.UserPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decodes catalog and user rows into typed records at the repository boundary.
 */
final class CatalogRowMappers {
    private static final Logger log = LoggerFactory.getLogger(CatalogRowMappers.class);

    private static final String GENRE_SEPARATOR_PATTERN = "\\s*[,;|]\\s*";

    private CatalogRowMappers() {
    }

    static RowMapper<Book> bookRowMapper() {
        return CatalogRowMappers::mapBook;
    }

    static RowMapper<UserPreferences> preferencesRowMapper() {
        return (rs, rowNum) -> new UserPreferences(
            rs.getString("favorite_genres"),
            rs.getString("favorite_authors"),
            rs.getString("favorite_books")
        );
    }

    private static Book mapBook(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        String rawGenres = rs.getString("genres");
        log.trace("Book row: id={}, title={}, author={}, genres={}",
            id, rs.getString("title"), rs.getString("author"), rawGenres);
        return new Book(
            id,
            rs.getString("title"),
            rs.getString("author"),
            rs.getString("description"),
            parseGenres(rawGenres),
            rs.getString("cover"),
            getIntOrNull(rs, "likes"),
            getIntOrNull(rs, "dislikes"),
            getDoubleOrNull(rs, "average_rating")
        );
    }

    /**
     * Splits the stored genre text ("Fantasy, Adventure") into trimmed, de-duplicated tags.
     */
    static List<String> parseGenres(String rawGenres) {
        if (rawGenres == null || rawGenres.isBlank()) {
            return List.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String part : rawGenres.trim().split(GENRE_SEPARATOR_PATTERN)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                tags.add(trimmed);
            }
        }
        return new ArrayList<>(tags);
    }

    static Integer getIntOrNull(ResultSet rs, String columnName) throws SQLException {
        int value = rs.getInt(columnName);
        return rs.wasNull() ? null : value;
    }

    static Double getDoubleOrNull(ResultSet rs, String columnName) throws SQLException {
        double value = rs.getDouble(columnName);
        return rs.wasNull() ? null : value;
    }
}
