package com.pulselog.api;

import java.util.Map;

/**
 * <b>Level: The Severity of a Log Entry.</b>
 * <p>
 * Lower value means higher severity. A logger configured with threshold
 * {@code INFO} dispatches {@code ERROR}, {@code WARN} and {@code INFO} and drops
 * {@code DEBUG} and {@code TRACE}.
 * </p>
 *
 * <h3>Why Primitive Constants?</h3>
 * <p>
 * The level is compared on every single log call, most of which are filtered
 * out. A {@code byte} comparison is a single instruction and the {@code Entry}
 * stores the level without a reference to chase. The name tables are built
 * once at class load and never mutated.
 * </p>
 */
public final class Level {
    public static final byte ERROR = 0;
    public static final byte WARN = 1;
    public static final byte INFO = 2;
    public static final byte DEBUG = 3;
    public static final byte TRACE = 4;

    /** Returned by {@link #byName(String)} for names outside the table. */
    public static final byte UNKNOWN = 5;

    private static final Map<String, Byte> NAME_TO_LEVEL = Map.of(
            "ERROR", ERROR,
            "WARN", WARN,
            "INFO", INFO,
            "DEBUG", DEBUG,
            "TRACE", TRACE);

    private static final String[] LEVEL_TO_NAME = { "ERROR", "WARN", "INFO", "DEBUG", "TRACE" };

    private Level() {
        // Prevent instantiation
    }

    /**
     * Case-insensitive lookup.
     *
     * @return the level constant, or {@link #UNKNOWN}
     */
    public static byte byName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        Byte level = NAME_TO_LEVEL.get(name.trim().toUpperCase());
        return level == null ? UNKNOWN : level;
    }

    public static String name(byte level) {
        if (level >= ERROR && level <= TRACE) {
            return LEVEL_TO_NAME[level];
        }
        return "Unknown";
    }

    public static boolean isValid(byte level) {
        return level >= ERROR && level <= TRACE;
    }
}
