package net.shelfmatch.util;

import java.util.Optional;
import java.util.OptionalInt;
import org.springframework.util.StringUtils;

/**
 * Parses the identifier and limit parameters accepted by the HTTP and command-line entry points.
 *
 * <p>Invalid input is reported with {@link IllegalArgumentException}; callers turn that into a
 * 400 response or an error payload before any recommendation work starts.</p>
 */
public final class RequestParameterParser {

    private RequestParameterParser() {
    }

    /**
     * @throws IllegalArgumentException when the value is missing, not a number or not positive
     */
    public static long requirePositiveId(String raw, String name) {
        if (!StringUtils.hasText(raw)) {
            throw new IllegalArgumentException(name + " is required");
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number", ex);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    /**
     * @return empty when the value is absent
     * @throws IllegalArgumentException when present but not a positive number
     */
    public static Optional<Long> optionalPositiveId(String raw, String name) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        return Optional.of(requirePositiveId(raw, name));
    }

    /**
     * @return empty when the value is absent
     * @throws IllegalArgumentException when present but not an integer
     */
    public static OptionalInt optionalInt(String raw, String name) {
        if (!StringUtils.hasText(raw)) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }
}
