package com.pulselog.core;

import com.pulselog.api.Level;

/**
 * The process-wide standard logger.
 * <p>
 * Writes to standard error through the default pattern at {@code DEBUG}
 * until replaced with {@link #setDefault(Logger)}:
 * </p>
 *
 * <pre>
 *   Log.info("Welcome ", "to ", "pulselog");
 *   Log.infof("%s, %s & %s", "simple", "flexible", "powerful logger");
 *
 *   // Output:
 *   2016-07-03 19:22:11.504 INFO  - Welcome to pulselog
 *   2016-07-03 19:22:11.504 INFO  - simple, flexible & powerful logger
 * </pre>
 */
public final class Log {

    static final String STANDARD_CONFIG = "receiver = CONSOLE\nlevel = DEBUG";

    private static volatile Logger standard;

    private Log() {
    }

    public static Logger getDefault() {
        Logger logger = standard;
        if (logger == null) {
            synchronized (Log.class) {
                logger = standard;
                if (logger == null) {
                    logger = LoggerFactory.create(STANDARD_CONFIG);
                    standard = logger;
                }
            }
        }
        return logger;
    }

    /**
     * Replaces the standard logger. The previous one is not closed.
     */
    public static void setDefault(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger must not be null");
        }
        standard = logger;
    }

    // Each helper calls Logger.log directly to keep the caller depth constant

    public static void error(Object... values) {
        getDefault().log(Level.ERROR, null, values);
    }

    public static void errorf(String format, Object... values) {
        getDefault().log(Level.ERROR, format, values);
    }

    public static void warn(Object... values) {
        getDefault().log(Level.WARN, null, values);
    }

    public static void warnf(String format, Object... values) {
        getDefault().log(Level.WARN, format, values);
    }

    public static void info(Object... values) {
        getDefault().log(Level.INFO, null, values);
    }

    public static void infof(String format, Object... values) {
        getDefault().log(Level.INFO, format, values);
    }

    public static void debug(Object... values) {
        getDefault().log(Level.DEBUG, null, values);
    }

    public static void debugf(String format, Object... values) {
        getDefault().log(Level.DEBUG, format, values);
    }

    public static void trace(Object... values) {
        getDefault().log(Level.TRACE, null, values);
    }

    public static void tracef(String format, Object... values) {
        getDefault().log(Level.TRACE, format, values);
    }
}
