package com.pulselog.core;

import com.pulselog.api.FmtFlag;

import java.time.format.DateTimeFormatter;

/**
 * One compiled unit of a pattern: a field to render or literal text to emit.
 * <p>
 * Immutable. A compiled list of parts is shared read-only by every render of the
 * logger that owns it, so everything derivable from the pattern (time formatter,
 * pad width) is resolved here once.
 * </p>
 */
public final class FlagPart {

    public final byte flag;
    public final String name;
    public final String format;

    // Resolved from format
    final DateTimeFormatter timeFormatter;
    final int width; // 0 = no padding
    final boolean leftAlign;

    FlagPart(byte flag, String name, String format, DateTimeFormatter timeFormatter, int width, boolean leftAlign) {
        this.flag = flag;
        this.name = name;
        this.format = format;
        this.timeFormatter = timeFormatter;
        this.width = width;
        this.leftAlign = leftAlign;
    }

    static FlagPart literal(String text) {
        return new FlagPart(FmtFlag.LITERAL, "literal", text, null, 0, false);
    }

    @Override
    public String toString() {
        return "FlagPart{" +
                "name='" + name + '\'' +
                ", format='" + format + '\'' +
                '}';
    }
}
