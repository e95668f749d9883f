package net.shelfmatch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.SQLException;
import net.shelfmatch.model.Book;
import org.junit.jupiter.api.Test;

class CatalogRowMappersTest {

    @Test
    void should_SplitAndDeduplicateGenres_When_ParsingStoredText() {
        assertThat(CatalogRowMappers.parseGenres(" Fantasy, Adventure;Fantasy | Classic ,"))
            .containsExactly("Fantasy", "Adventure", "Classic");
        assertThat(CatalogRowMappers.parseGenres(null)).isEmpty();
        assertThat(CatalogRowMappers.parseGenres("   ")).isEmpty();
    }

    @Test
    void should_KeepNullNumbers_When_ColumnsAreNull() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getLong("id")).thenReturn(12L);
        when(rs.getString("title")).thenReturn("Dune");
        when(rs.getString("author")).thenReturn("Herbert");
        when(rs.getString("description")).thenReturn("Desert planet");
        when(rs.getString("genres")).thenReturn("Sci-Fi");
        when(rs.getString("cover")).thenReturn("dune.jpg");
        when(rs.getInt("likes")).thenReturn(0);
        when(rs.getInt("dislikes")).thenReturn(3);
        when(rs.getDouble("average_rating")).thenReturn(0.0);
        when(rs.wasNull()).thenReturn(true, false, true);

        Book book = CatalogRowMappers.bookRowMapper().mapRow(rs, 0);

        assertThat(book.id()).isEqualTo(12L);
        assertThat(book.genres()).containsExactly("Sci-Fi");
        assertThat(book.likeCount()).isNull();
        assertThat(book.dislikeCount()).isEqualTo(3);
        assertThat(book.averageRating()).isNull();
    }
}
