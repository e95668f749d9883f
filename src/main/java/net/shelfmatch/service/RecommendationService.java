/**
 * Produces ranked book recommendations for one user.
 *
 * <p>Users with like, dislike or rating activity go through content scoring
 * ({@link ContentScorer}), author diversification ({@link AuthorDiversityFilter}) and, when the
 * diversified list is short, a popularity top-up ({@link PopularityRanker}). Users without such
 * activity get the popularity ranking directly.</p>
 *
 * <p>"No data" is never an error: an empty catalog yields an empty list. Only repository
 * failures propagate, as {@link net.shelfmatch.exception.RecommendationDataAccessException}.</p>
 */
package net.shelfmatch.service;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.model.Book;
import net.shelfmatch.model.UserActivity;
import net.shelfmatch.model.UserProfile;
import net.shelfmatch.repository.UserActivityRepository;
import net.shelfmatch.service.feature.FeatureBuilder;
import net.shelfmatch.service.feature.FeatureMatrix;
import net.shelfmatch.service.scoring.AuthorDiversityFilter;
import net.shelfmatch.service.scoring.ContentScorer;
import net.shelfmatch.service.scoring.PopularityRanker;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
@Slf4j
public class RecommendationService {

    private static final int CONTENT_HEADROOM_FACTOR = 2;

    private final CatalogLoader catalogLoader;
    private final UserActivityRepository userActivityRepository;
    private final UserProfileBuilder userProfileBuilder;
    private final FeatureBuilder featureBuilder;
    private final ContentScorer contentScorer;
    private final AuthorDiversityFilter authorDiversityFilter;
    private final PopularityRanker popularityRanker;
    private final int maxCount;

    public RecommendationService(CatalogLoader catalogLoader,
                                 UserActivityRepository userActivityRepository,
                                 UserProfileBuilder userProfileBuilder,
                                 FeatureBuilder featureBuilder,
                                 ContentScorer contentScorer,
                                 AuthorDiversityFilter authorDiversityFilter,
                                 PopularityRanker popularityRanker,
                                 RecommendationProperties properties) {
        this.catalogLoader = catalogLoader;
        this.userActivityRepository = userActivityRepository;
        this.userProfileBuilder = userProfileBuilder;
        this.featureBuilder = featureBuilder;
        this.contentScorer = contentScorer;
        this.authorDiversityFilter = authorDiversityFilter;
        this.popularityRanker = popularityRanker;
        this.maxCount = properties.getMaxCount();
    }

    /**
     * Recommends books for a user.
     *
     * @param userId the user to recommend for
     * @param excludeBookId a book to leave out (typically the one being viewed), may be null
     * @param count requested size; non-positive yields an empty list, larger than the configured
     *              maximum is clamped. Callers apply the configured default when no size was given.
     * @return immutable ranked list, at most {@code count} long, without duplicates and without
     *         any book the user liked or disliked
     */
    public List<ScoredBook> recommend(long userId, @Nullable Long excludeBookId, int count) {
        if (count <= 0) {
            log.debug("Non-positive count {} requested for user {}; returning no recommendations.", count, userId);
            return List.of();
        }
        int effectiveCount = Math.min(count, maxCount);
        List<Book> catalog = catalogLoader.loadCatalog();
        if (catalog.isEmpty()) {
            log.info("Catalog is empty; no recommendations for user {}.", userId);
            return List.of();
        }

        Set<Long> excluded = excludeBookId == null ? Set.of() : Set.of(excludeBookId);
        UserActivity activity = userActivityRepository.fetchActivity(userId);
        Optional<UserProfile> profile = userProfileBuilder.build(activity);
        if (profile.isEmpty()) {
            List<ScoredBook> popular = popularityRanker.rank(catalog, effectiveCount, excluded);
            log.info("Cold start for user {}: {} popularity recommendations from {} books.",
                userId, popular.size(), catalog.size());
            return popular;
        }
        return recommendForProfile(profile.get(), catalog, excluded, effectiveCount);
    }

    /**
     * Runs {@link #recommend(long, Long, int)} on the bounded elastic scheduler.
     */
    public Mono<List<ScoredBook>> recommendReactive(long userId, @Nullable Long excludeBookId, int count) {
        return Mono.fromCallable(() -> recommend(userId, excludeBookId, count))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private List<ScoredBook> recommendForProfile(UserProfile profile,
                                                 List<Book> catalog,
                                                 Set<Long> excluded,
                                                 int count) {
        FeatureMatrix matrix = featureBuilder.build(catalog);
        List<ScoredBook> content = contentScorer.score(
            catalog, matrix, profile.likedIds(), profile.dislikedIds(), excluded, CONTENT_HEADROOM_FACTOR * count);
        List<ScoredBook> diversified = authorDiversityFilter.diversify(content);

        List<ScoredBook> blended = new ArrayList<>(diversified.subList(0, Math.min(count, diversified.size())));
        int topUpCount = count - blended.size();
        if (topUpCount > 0) {
            Set<Long> taken = new LinkedHashSet<>(profile.interactedIds());
            taken.addAll(excluded);
            blended.forEach(scored -> taken.add(scored.bookId()));
            blended.addAll(popularityRanker.rank(catalog, topUpCount, taken));
        }

        log.info("Content recommendations for user {}: {} liked, {} disliked, {} scored, {} after diversity, {} returned.",
            profile.userId(), profile.likedIds().size(), profile.dislikedIds().size(),
            content.size(), diversified.size(), blended.size());
        return List.copyOf(blended);
    }
}
