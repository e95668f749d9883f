package net.shelfmatch.service.feature;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.model.Book;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Caches built feature matrices under an explicit catalog fingerprint.
 *
 * <p>A catalog that changed in any field the features read hashes to a different key, so a matrix
 * fitted against an older catalog is never served. When disabled every call builds.</p>
 */
@Component
@Slf4j
public class FeatureMatrixCache {

    private final Cache<String, FeatureMatrix> cache;
    private final boolean enabled;
    private final double maxRating;

    public FeatureMatrixCache(@Qualifier("featureMatrixStore") Cache<String, FeatureMatrix> cache,
                              RecommendationProperties properties) {
        this.cache = cache;
        this.enabled = properties.getFeatureCache().isEnabled();
        this.maxRating = properties.getMaxRating();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the cached matrix for this exact catalog, building it on a miss.
     */
    public FeatureMatrix getOrBuild(List<Book> books, Function<List<Book>, FeatureMatrix> builder) {
        if (!enabled) {
            return builder.apply(books);
        }
        String fingerprint = CatalogFingerprint.of(books, maxRating);
        FeatureMatrix cached = cache.getIfPresent(fingerprint);
        if (cached != null) {
            log.debug("Feature matrix cache hit for catalog {} ({} books)", fingerprint, books.size());
            return cached;
        }
        return cache.get(fingerprint, key -> {
            log.debug("Feature matrix cache miss for catalog {} ({} books)", key, books.size());
            return builder.apply(books);
        });
    }
}
