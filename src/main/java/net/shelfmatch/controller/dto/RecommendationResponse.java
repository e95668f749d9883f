package net.shelfmatch.controller.dto;

import java.util.List;

/**
 * Response body of {@code GET /api/recommendations}: {@code {"recommendations": [...]}}.
 */
public record RecommendationResponse(List<RecommendationDto> recommendations) {
    public RecommendationResponse {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
