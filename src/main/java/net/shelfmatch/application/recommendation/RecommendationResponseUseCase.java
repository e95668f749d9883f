package net.shelfmatch.application.recommendation;

import java.util.ArrayList;
import java.util.List;
import net.shelfmatch.controller.dto.RecommendationDto;
import net.shelfmatch.controller.dto.RecommendationResponse;
import net.shelfmatch.model.Book;
import net.shelfmatch.service.ScoredBook;
import org.springframework.stereotype.Service;

/**
 * Maps ranked recommendations into the transport payload shared by the REST endpoint and the
 * command-line runner.
 *
 * <p>Order is preserved. Missing counts and ratings stay {@code null}; NaN and infinite doubles
 * become {@code null} rather than leaking into JSON.</p>
 */
@Service
public class RecommendationResponseUseCase {

    /**
     * @param recommendations ranked recommendations, may be null
     * @return response wrapping one DTO per recommendation
     */
    public RecommendationResponse toResponse(List<ScoredBook> recommendations) {
        if (recommendations == null || recommendations.isEmpty()) {
            return new RecommendationResponse(List.of());
        }
        List<RecommendationDto> dtos = new ArrayList<>(recommendations.size());
        for (ScoredBook scored : recommendations) {
            if (scored != null) {
                dtos.add(toDto(scored));
            }
        }
        return new RecommendationResponse(dtos);
    }

    RecommendationDto toDto(ScoredBook scored) {
        Book book = scored.book();
        return new RecommendationDto(
            book.id(),
            book.title(),
            book.author(),
            book.description(),
            book.genres(),
            book.cover(),
            book.likeCount(),
            book.dislikeCount(),
            finiteOrNull(book.averageRating()),
            finiteOrNull(scored.score()),
            scored.source().wireValue()
        );
    }

    static Double finiteOrNull(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }
}
