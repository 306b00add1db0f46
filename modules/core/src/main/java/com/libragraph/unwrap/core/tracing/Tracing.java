package com.libragraph.unwrap.core.tracing;

import com.libragraph.unwrap.core.error.ConfigException;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-time console logging setup for the {@code com.libragraph.unwrap} loggers.
 *
 * <p>jboss-logging falls back to java.util.logging when no other backend is on the class path;
 * this installs a console handler on the package logger at the requested level.
 * Only the first successful call has an effect.
 */
public final class Tracing {

    public static final String LOGGER_NAME = "com.libragraph.unwrap";

    static final String PROVIDER_PROPERTY = "org.jboss.logging.provider";

    private static final AtomicBoolean installed = new AtomicBoolean();

    private Tracing() {
    }

    /**
     * @param level one of TRACE, DEBUG, INFO, WARN, ERROR (case-insensitive)
     * @return true if this call installed the handler, false if tracing was already enabled
     * @throws ConfigException if the level is not recognized
     */
    public static boolean enable(String level) {
        Level julLevel = toJulLevel(level);
        if (!installed.compareAndSet(false, true)) {
            return false;
        }
        // only honoured if no jboss-logging logger has been created yet
        if (System.getProperty(PROVIDER_PROPERTY) == null) {
            System.setProperty(PROVIDER_PROPERTY, "jdk");
        }
        Logger logger = Logger.getLogger(LOGGER_NAME);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(julLevel);
        logger.addHandler(handler);
        logger.setLevel(julLevel);
        logger.setUseParentHandlers(false);
        org.jboss.logging.Logger.getLogger(Tracing.class).debugf("Tracing enabled at %s", level);
        return true;
    }

    public static boolean isEnabled() {
        return installed.get();
    }

    static Level toJulLevel(String level) {
        String name = level == null ? "" : level.trim().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "TRACE" -> Level.FINEST;
            case "DEBUG" -> Level.FINE;
            case "INFO" -> Level.INFO;
            case "WARN" -> Level.WARNING;
            case "ERROR" -> Level.SEVERE;
            default -> throw new ConfigException("tracing level", String.valueOf(level),
                    "one of TRACE, DEBUG, INFO, WARN, ERROR");
        };
    }
}
