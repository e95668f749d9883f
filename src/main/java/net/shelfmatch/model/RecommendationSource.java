package net.shelfmatch.model;

/**
 * Provenance of a recommendation in the blended list.
 */
public enum RecommendationSource {
    CONTENT_BASED("content_based"),
    POPULARITY("popularity");

    private final String wireValue;

    RecommendationSource(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
