package com.pulselog.core;

import java.util.Locale;

/**
 * File rotation modes.
 * <ul>
 * <li>{@code daily} - rotate on the first write of a new calendar day</li>
 * <li>{@code size} - rotate before a write that would push the file past its
 * byte limit</li>
 * <li>{@code lines} - rotate once the current file holds the configured number
 * of lines</li>
 * <li>anything else - never rotate</li>
 * </ul>
 */
public final class Rotation {
    public static final byte NONE = 0;
    public static final byte DAILY = 1;
    public static final byte SIZE = 2;
    public static final byte LINES = 3;

    public static final int MAX_SIZE_MB = 2048;
    public static final long MAX_SIZE_BYTES = MAX_SIZE_MB * 1024L * 1024L;

    private Rotation() {
        // Prevent instantiation
    }

    public static byte byName(String name) {
        if (name == null) {
            return NONE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "daily":
                return DAILY;
            case "size":
                return SIZE;
            case "lines":
                return LINES;
            default:
                return NONE;
        }
    }
}
