package net.shelfmatch.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of user interaction recorded upstream.
 */
public enum ActivityKind {
    LIKE("like"),
    DISLIKE("dislike"),
    RATING("rating");

    private final String storedValue;

    ActivityKind(String storedValue) {
        this.storedValue = storedValue;
    }

    public String storedValue() {
        return storedValue;
    }

    /**
     * Resolves the value stored in the {@code likes.action} column.
     */
    public static Optional<ActivityKind> fromStoredValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return Optional.empty();
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (ActivityKind kind : values()) {
            if (kind.storedValue.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
