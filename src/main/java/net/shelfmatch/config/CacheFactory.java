package net.shelfmatch.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import net.shelfmatch.service.feature.FeatureMatrix;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the Caffeine caches used by the recommendation pipeline.
 */
@Configuration
public class CacheFactory {

    /**
     * Create a cache bounded by size and write TTL.
     */
    public static <K, V> Cache<K, V> createCache(int maxSize, Duration ttl) {
        return Caffeine.newBuilder()
            .maximumSize(Math.max(1, maxSize))
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Feature matrices keyed by catalog fingerprint. Sized from
     * {@code app.recommendations.feature-cache.*}.
     */
    @Bean
    public Cache<String, FeatureMatrix> featureMatrixStore(RecommendationProperties properties) {
        RecommendationProperties.FeatureCache settings = properties.getFeatureCache();
        return createCache(settings.getMaxEntries(), settings.getTtl());
    }
}
