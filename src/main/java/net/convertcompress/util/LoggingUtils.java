package net.convertcompress.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging a message together with its cause, keeping the placeholder
 * arguments intact.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, LogLevel.ERROR, throwable, message, args);
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, LogLevel.WARN, throwable, message, args);
    }

    public static void debug(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || !logger.isDebugEnabled()) {
            return;
        }
        log(logger, LogLevel.DEBUG, throwable, message, args);
    }

    private static void log(Logger logger, LogLevel level, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        Object[] finalArgs = withCause(throwable, args);
        switch (level) {
            case ERROR -> logger.error(message, finalArgs);
            case WARN -> logger.warn(message, finalArgs);
            case DEBUG -> logger.debug(message, finalArgs);
        }
    }

    private static Object[] withCause(Throwable throwable, Object[] args) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] combined = Arrays.copyOf(base, base.length + 1);
        combined[combined.length - 1] = throwable;
        return combined;
    }

    private enum LogLevel {
        ERROR,
        WARN,
        DEBUG
    }
}
