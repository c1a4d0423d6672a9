package com.pulselog.core;

import com.pulselog.api.Entry;
import com.pulselog.api.FmtFlag;
import com.pulselog.api.Level;

import java.time.Instant;
import java.util.Arrays;
import java.util.Formatter;
import java.util.IllegalFormatException;
import java.util.List;

/**
 * <b>Renders an {@link Entry} through a compiled pattern.</b>
 * <p>
 * Each instance owns one reusable {@link StringBuilder} (and a
 * {@link Formatter} bound to it), so it is <b>not</b> thread-safe: a receiver
 * creates its own and only calls it while holding its write lock.
 * </p>
 *
 * <h3>Message Rendering</h3>
 * <ul>
 * <li><b>Values only:</b> string forms are concatenated; a space is inserted
 * between two adjacent values when neither is a {@link CharSequence}.
 * {@code info("Welcome ", "to ", "pulselog")} gives {@code Welcome to pulselog},
 * {@code info(1, 2, "x")} gives {@code 1 2x}.</li>
 * <li><b>Template:</b> {@code infof("%s, %s", a, b)} goes through
 * {@link Formatter}. A template that does not fit its values is rendered raw,
 * followed by the values and the formatter's complaint.</li>
 * </ul>
 * <p>
 * Line breaks inside the message, from {@code %n} or from the values, are
 * rendered as spaces so an entry never spans two lines of output.
 * </p>
 */
public class PatternFormatter {

    static final String UNKNOWN_FILE = "???";

    private static final Object[] NO_VALUES = new Object[0];

    private final List<FlagPart> parts;
    private final StringBuilder line = new StringBuilder(256);
    private final Formatter formatter = new Formatter(line);

    public PatternFormatter(List<FlagPart> parts) {
        this.parts = parts;
    }

    public List<FlagPart> parts() {
        return parts;
    }

    /**
     * Renders the entry without line terminator. The returned sequence is reused
     * by the next call.
     */
    public CharSequence render(Entry entry) {
        line.setLength(0);
        for (int i = 0; i < parts.size(); i++) {
            FlagPart part = parts.get(i);
            int start = line.length();
            switch (part.flag) {
                case FmtFlag.LEVEL:
                    line.append(Level.name(entry.level));
                    break;
                case FmtFlag.TIME:
                case FmtFlag.UTC_TIME:
                    part.timeFormatter.formatTo(Instant.ofEpochMilli(entry.time), line);
                    break;
                case FmtFlag.LONG_FILE:
                    appendLongFile(entry);
                    break;
                case FmtFlag.SHORT_FILE:
                    line.append(entry.file == null ? UNKNOWN_FILE : entry.file);
                    break;
                case FmtFlag.LINE:
                    line.append('L').append(entry.line);
                    break;
                case FmtFlag.MESSAGE:
                    appendMessage(entry);
                    break;
                case FmtFlag.CUSTOM:
                case FmtFlag.LITERAL:
                    line.append(part.format);
                    break;
                default:
                    break;
            }
            if (part.width > 0) {
                pad(start, part);
            }
        }
        return line;
    }

    private void appendLongFile(Entry entry) {
        if (entry.file == null) {
            line.append(UNKNOWN_FILE);
            return;
        }
        if (entry.className != null) {
            int pkgEnd = entry.className.lastIndexOf('.');
            if (pkgEnd > 0) {
                for (int i = 0; i < pkgEnd; i++) {
                    char c = entry.className.charAt(i);
                    line.append(c == '.' ? '/' : c);
                }
                line.append('/');
            }
        }
        line.append(entry.file);
    }

    private void appendMessage(Entry entry) {
        int start = line.length();
        Object[] values = entry.values == null ? NO_VALUES : entry.values;
        if (entry.hasFormat()) {
            appendTemplate(entry.format, values, start);
        } else {
            appendValues(values);
        }
        flattenLineBreaks(start);
    }

    private void appendTemplate(String format, Object[] values, int start) {
        try {
            formatter.format(format, values);
        } catch (IllegalFormatException e) {
            line.setLength(start);
            line.append(format)
                    .append(' ')
                    .append(Arrays.toString(values))
                    .append(" (bad format: ")
                    .append(e.getMessage())
                    .append(')');
        }
    }

    // One entry, one line: %n and embedded breaks become spaces
    private void flattenLineBreaks(int start) {
        for (int i = start; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\n' || c == '\r') {
                line.setCharAt(i, ' ');
            }
        }
    }

    private void appendValues(Object[] values) {
        boolean prevIsText = true;
        for (int i = 0; i < values.length; i++) {
            Object value = values[i];
            boolean isText = value instanceof CharSequence;
            if (i > 0 && !isText && !prevIsText) {
                line.append(' ');
            }
            line.append(value);
            prevIsText = isText;
        }
    }

    private void pad(int start, FlagPart part) {
        int missing = part.width - (line.length() - start);
        if (missing <= 0) {
            return;
        }
        if (part.leftAlign) {
            for (int i = 0; i < missing; i++) {
                line.append(' ');
            }
        } else {
            for (int i = 0; i < missing; i++) {
                line.insert(start, ' ');
            }
        }
    }
}
