package com.pulselog.api;

import java.util.Arrays;

/**
 * One log occurrence: level, timestamp, message template, values and the
 * optional caller location.
 * <p>
 * Entries are pooled. The logger fills the public fields, hands the entry to a
 * receiver and recycles it once the receiver returns, so an entry must never be
 * retained past {@code Receiver.output}.
 * </p>
 */
public class Entry {
    private static final Object[] NO_VALUES = new Object[0];

    public byte level;
    public long time; // epoch millis
    public String format;
    public Object[] values = NO_VALUES;

    // Caller location; only populated when the pattern renders it
    public String className;
    public String file;
    public int line;

    public void reset() {
        level = 0;
        time = 0;
        format = null;
        values = NO_VALUES;
        className = null;
        file = null;
        line = 0;
    }

    public boolean hasFormat() {
        return format != null && !format.isEmpty();
    }

    @Override
    public String toString() {
        return "Entry{" +
                "level=" + Level.name(level) +
                ", time=" + time +
                ", format='" + format + '\'' +
                ", values=" + Arrays.toString(values) +
                ", file='" + file + '\'' +
                ", line=" + line +
                '}';
    }
}
