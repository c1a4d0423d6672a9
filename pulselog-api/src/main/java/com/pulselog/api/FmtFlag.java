package com.pulselog.api;

import java.util.Map;

/**
 * Format flags understood by the pattern compiler.
 * <p>
 * Usage of flag order is up to the pattern composition:
 * </p>
 * <ul>
 * <li>{@code level} - INFO, DEBUG, ERROR, so on</li>
 * <li>{@code time} - local time as per the supplied layout</li>
 * <li>{@code utctime} - UTC time as per the supplied layout</li>
 * <li>{@code longfile} - source path derived from the caller class:
 * {@code com/acme/Service.java}</li>
 * <li>{@code shortfile} - final file name element: {@code Service.java}</li>
 * <li>{@code line} - caller line number: {@code L23}</li>
 * <li>{@code message} - the message along with its values</li>
 * <li>{@code custom} - the supplied text as-is</li>
 * </ul>
 * {@link #LITERAL} is never written in a pattern; the compiler produces it for
 * the text between flags.
 */
public final class FmtFlag {
    public static final byte LEVEL = 0;
    public static final byte TIME = 1;
    public static final byte UTC_TIME = 2;
    public static final byte LONG_FILE = 3;
    public static final byte SHORT_FILE = 4;
    public static final byte LINE = 5;
    public static final byte MESSAGE = 6;
    public static final byte CUSTOM = 7;
    public static final byte LITERAL = 8;
    public static final byte UNKNOWN = 9;

    private static final Map<String, Byte> NAME_TO_FLAG = Map.of(
            "level", LEVEL,
            "time", TIME,
            "utctime", UTC_TIME,
            "longfile", LONG_FILE,
            "shortfile", SHORT_FILE,
            "line", LINE,
            "message", MESSAGE,
            "custom", CUSTOM);

    private FmtFlag() {
        // Prevent instantiation
    }

    public static byte byName(String name) {
        Byte flag = NAME_TO_FLAG.get(name);
        return flag == null ? UNKNOWN : flag;
    }

    /**
     * @return true if the flag needs the caller location captured before dispatch
     */
    public static boolean isCallerFlag(byte flag) {
        return flag == LONG_FILE || flag == SHORT_FILE || flag == LINE;
    }
}
