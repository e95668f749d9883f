package net.shelfmatch.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;

/**
 * Strongly typed configuration for the recommendation pipeline.
 *
 * <p>The penalty weight and diversity factor have no documented derivation; they are exposed
 * here so deployments can tune them, with defaults matching the long-standing behavior.</p>
 */
@Component
@ConfigurationProperties(prefix = "app.recommendations")
public class RecommendationProperties {

    /**
     * Number of recommendations returned when the caller does not ask for a specific count.
     */
    private int defaultCount = 4;

    /**
     * Upper bound applied to requested counts.
     */
    private int maxCount = 50;

    /**
     * Weight applied to disliked-affinity before it is subtracted from liked-affinity.
     */
    private double penaltyWeight = 0.3;

    /**
     * Largest share of a diversified list one author may occupy.
     */
    private double diversityFactor = 0.3;

    /**
     * Upper bound of the rating scale; stored averages are clamped to [0, maxRating].
     */
    private double maxRating = 5.0;

    private final FeatureCache featureCache = new FeatureCache();

    @PostConstruct
    void validate() {
        Assert.isTrue(defaultCount > 0, "app.recommendations.default-count must be positive");
        Assert.isTrue(maxCount >= defaultCount, "app.recommendations.max-count must be >= default-count");
        Assert.isTrue(penaltyWeight >= 0.0, "app.recommendations.penalty-weight must not be negative");
        Assert.isTrue(diversityFactor > 0.0 && diversityFactor <= 1.0,
            "app.recommendations.diversity-factor must be in (0, 1]");
        Assert.isTrue(maxRating > 0.0, "app.recommendations.max-rating must be positive");
    }

    public int getDefaultCount() {
        return defaultCount;
    }

    public void setDefaultCount(int defaultCount) {
        this.defaultCount = defaultCount;
    }

    public int getMaxCount() {
        return maxCount;
    }

    public void setMaxCount(int maxCount) {
        this.maxCount = maxCount;
    }

    public double getPenaltyWeight() {
        return penaltyWeight;
    }

    public void setPenaltyWeight(double penaltyWeight) {
        this.penaltyWeight = penaltyWeight;
    }

    public double getDiversityFactor() {
        return diversityFactor;
    }

    public void setDiversityFactor(double diversityFactor) {
        this.diversityFactor = diversityFactor;
    }

    public double getMaxRating() {
        return maxRating;
    }

    public void setMaxRating(double maxRating) {
        this.maxRating = maxRating;
    }

    public FeatureCache getFeatureCache() {
        return featureCache;
    }

    /**
     * Settings for the fingerprint-keyed feature matrix cache.
     */
    public static class FeatureCache {

        private boolean enabled = true;

        private int maxEntries = 8;

        private Duration ttl = Duration.ofMinutes(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }
}
