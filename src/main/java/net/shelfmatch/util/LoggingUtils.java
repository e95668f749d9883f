package net.shelfmatch.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Logs warnings and errors with the cause appended as the final SLF4J argument.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.error(message, withCause(throwable, args));
        }
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.warn(message, withCause(throwable, args));
        }
    }

    static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] combined = Arrays.copyOf(base, base.length + 1);
        combined[base.length] = throwable;
        return combined;
    }
}
