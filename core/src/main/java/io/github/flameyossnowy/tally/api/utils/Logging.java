package io.github.flameyossnowy.tally.api.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Library-wide logging switch.
 * <p>
 * {@link #ENABLED} gates info output, {@link #DEEP} additionally gates per-event tracing.
 * Warnings and errors are always forwarded.
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("io.github.flameyossnowy.tally");

    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private Logging() {
        throw new AssertionError("No instances");
    }

    public static void info(Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void info(String message) {
        if (ENABLED) {
            LOGGER.info(message);
        }
    }

    public static void deepInfo(Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable throwable) {
        LOGGER.error(message, throwable);
    }
}
