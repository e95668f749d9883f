/**
 * REST controller exposing per-user book recommendations.
 */
package net.shelfmatch.controller;

import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.application.recommendation.RecommendationResponseUseCase;
import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.controller.support.ErrorResponseUtils;
import net.shelfmatch.exception.RecommendationDataAccessException;
import net.shelfmatch.service.RecommendationService;
import net.shelfmatch.util.LoggingUtils;
import net.shelfmatch.util.RequestParameterParser;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/recommendations")
@Slf4j
public class RecommendationController {

    private final RecommendationService recommendationService;
    private final RecommendationResponseUseCase recommendationResponseUseCase;
    private final int defaultCount;

    public RecommendationController(RecommendationService recommendationService,
                                    RecommendationResponseUseCase recommendationResponseUseCase,
                                    RecommendationProperties properties) {
        this.recommendationService = recommendationService;
        this.recommendationResponseUseCase = recommendationResponseUseCase;
        this.defaultCount = properties.getDefaultCount();
    }

    /**
     * Recommends books for a user.
     *
     * @param userId required positive user id
     * @param bookId optional id of the book being viewed, left out of the result
     * @param limit optional result size; absent uses the configured default, non-positive yields an empty list
     * @return 200 with the recommendations, 400 for invalid parameters, 503 when the catalog or
     *         activity store is unavailable
     */
    @GetMapping
    public Mono<ResponseEntity<Object>> recommend(@RequestParam(name = "userId", required = false) String userId,
                                                  @RequestParam(name = "bookId", required = false) String bookId,
                                                  @RequestParam(name = "limit", required = false) String limit) {
        long parsedUserId;
        Long excludedBookId;
        int requestedCount;
        try {
            parsedUserId = RequestParameterParser.requirePositiveId(userId, "userId");
            excludedBookId = RequestParameterParser.optionalPositiveId(bookId, "bookId").orElse(null);
            requestedCount = RequestParameterParser.optionalInt(limit, "limit").orElse(defaultCount);
        } catch (IllegalArgumentException ex) {
            log.debug("Rejected recommendation request: {}", ex.getMessage());
            return Mono.just(ErrorResponseUtils.badRequest(ex.getMessage()));
        }

        return recommendationService.recommendReactive(parsedUserId, excludedBookId, requestedCount)
            .map(recommendationResponseUseCase::toResponse)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(RecommendationDataAccessException.class, ex -> {
                LoggingUtils.error(log, ex, "Recommendation data unavailable for user {} ({})",
                    parsedUserId, ex.getOperation());
                return Mono.just(ErrorResponseUtils.serviceUnavailable("Recommendation data is temporarily unavailable"));
            })
            .onErrorResume(ex -> {
                LoggingUtils.error(log, ex, "Failed to compute recommendations for user {}", parsedUserId);
                return Mono.just(ErrorResponseUtils.internalServerError("Failed to compute recommendations"));
            });
    }
}
