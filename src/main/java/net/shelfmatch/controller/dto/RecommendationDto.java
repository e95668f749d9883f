package net.shelfmatch.controller.dto;

import java.util.List;

/**
 * One recommended book as exposed over JSON.
 *
 * <p>Numeric fields are boxed so that absent or non-finite values serialize as {@code null}.</p>
 */
public record RecommendationDto(
    Long id,
    String title,
    String author,
    String description,
    List<String> genres,
    String cover,
    Integer likes,
    Integer dislikes,
    Double averageRating,
    Double score,
    String source
) {
    public RecommendationDto {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }
}
