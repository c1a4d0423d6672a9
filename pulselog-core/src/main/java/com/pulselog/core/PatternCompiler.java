package com.pulselog.core;

import com.pulselog.api.FmtFlag;
import com.pulselog.api.LogConfigurationException;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <b>The Pattern Compiler.</b>
 * <p>
 * Turns a textual pattern into the ordered list of {@link FlagPart}s that every
 * render walks. Compilation happens once, when the logger is built; the render
 * path never looks at the pattern string again.
 * </p>
 *
 * <h3>Grammar</h3>
 *
 * <pre>
 *   pattern := ( literal | '%%' | '%' name [ ':' aux ] )*
 *   name    := level | time | utctime | longfile | shortfile | line | message | custom
 *   aux     := layout | text | pad
 *   layout  := DateTimeFormatter pattern up to the next '%' (time, utctime)
 *   text    := any text up to the next '%' (custom)
 *   pad     := [ '-' ] digits, negative pads on the right (all other flags)
 * </pre>
 *
 * <p>
 * For example {@code %time:yyyy-MM-dd HH:mm:ss.SSS %level:-5 %custom:- %message}
 * compiles to {@code [time, " ", level, " ", custom, " ", message]} and renders as
 * {@code 2016-07-03 19:22:11.504 INFO  - Welcome to pulselog}.
 * </p>
 */
public final class PatternCompiler {

    public static final String DEFAULT_TIME_LAYOUT = "yyyy-MM-dd HH:mm:ss.SSS";

    public static final String DEFAULT_PATTERN = "%time:" + DEFAULT_TIME_LAYOUT + " %level:-5 %custom:- %message";

    public static final String ERR_FORMAT_STRING_EMPTY = "log format string is empty";

    private static final char FLAG_SEPARATOR = '%';
    private static final char FLAG_VALUE_SEPARATOR = ':';

    private PatternCompiler() {
    }

    public static List<FlagPart> compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new LogConfigurationException(ERR_FORMAT_STRING_EMPTY);
        }

        List<FlagPart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int n = pattern.length();
        int i = 0;

        while (i < n) {
            char c = pattern.charAt(i);
            if (c != FLAG_SEPARATOR) {
                literal.append(c);
                i++;
                continue;
            }
            if (i + 1 < n && pattern.charAt(i + 1) == FLAG_SEPARATOR) {
                literal.append(FLAG_SEPARATOR);
                i += 2;
                continue;
            }

            flushLiteral(parts, literal);

            int nameEnd = i + 1;
            while (nameEnd < n && Character.isLetter(pattern.charAt(nameEnd))) {
                nameEnd++;
            }
            String name = pattern.substring(i + 1, nameEnd);
            byte flag = FmtFlag.byName(name);
            if (flag == FmtFlag.UNKNOWN) {
                throw new LogConfigurationException("unrecognized log format flag: " + FLAG_SEPARATOR + name);
            }

            if (nameEnd < n && pattern.charAt(nameEnd) == FLAG_VALUE_SEPARATOR && isPadFlag(flag)) {
                int auxEnd = nameEnd + 1;
                if (auxEnd < n && pattern.charAt(auxEnd) == '-') {
                    auxEnd++;
                }
                while (auxEnd < n && Character.isDigit(pattern.charAt(auxEnd))) {
                    auxEnd++;
                }
                String pad = pattern.substring(nameEnd + 1, auxEnd);
                if (pad.isEmpty() || pad.equals("-")) {
                    throw new LogConfigurationException("invalid pad spec for " + FLAG_SEPARATOR + name
                            + ": " + pattern.substring(nameEnd + 1));
                }
                parts.add(createPart(flag, name, pad));
                i = auxEnd;
            } else if (nameEnd < n && pattern.charAt(nameEnd) == FLAG_VALUE_SEPARATOR) {
                int auxEnd = pattern.indexOf(FLAG_SEPARATOR, nameEnd + 1);
                if (auxEnd < 0) {
                    auxEnd = n;
                }
                String raw = pattern.substring(nameEnd + 1, auxEnd);
                String aux = raw.stripTrailing();
                parts.add(createPart(flag, name, aux));
                literal.append(raw, aux.length(), raw.length());
                i = auxEnd;
            } else {
                parts.add(createPart(flag, name, null));
                i = nameEnd;
            }
        }
        flushLiteral(parts, literal);

        return Collections.unmodifiableList(parts);
    }

    public static boolean isFlagExists(List<FlagPart> parts, byte flag) {
        for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i).flag == flag) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if rendering needs the caller's file or line
     */
    public static boolean isCallerInfoRequired(List<FlagPart> parts) {
        for (int i = 0; i < parts.size(); i++) {
            if (FmtFlag.isCallerFlag(parts.get(i).flag)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isPadFlag(byte flag) {
        return flag != FmtFlag.TIME && flag != FmtFlag.UTC_TIME && flag != FmtFlag.CUSTOM;
    }

    private static void flushLiteral(List<FlagPart> parts, StringBuilder literal) {
        if (literal.length() > 0) {
            parts.add(FlagPart.literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static FlagPart createPart(byte flag, String name, String aux) {
        switch (flag) {
            case FmtFlag.TIME:
            case FmtFlag.UTC_TIME: {
                String layout = isEmpty(aux) ? DEFAULT_TIME_LAYOUT : aux;
                ZoneId zone = flag == FmtFlag.UTC_TIME ? ZoneOffset.UTC : ZoneId.systemDefault();
                return new FlagPart(flag, name, layout, timeFormatter(layout, zone), 0, false);
            }
            case FmtFlag.CUSTOM:
                return new FlagPart(flag, name, aux == null ? "" : aux, null, 0, false);
            default: {
                if (isEmpty(aux)) {
                    return new FlagPart(flag, name, "", null, 0, false);
                }
                int width = padWidth(name, aux);
                return new FlagPart(flag, name, aux, null, Math.abs(width), width < 0);
            }
        }
    }

    private static DateTimeFormatter timeFormatter(String layout, ZoneId zone) {
        try {
            return DateTimeFormatter.ofPattern(layout).withZone(zone);
        } catch (IllegalArgumentException e) {
            throw new LogConfigurationException("invalid time layout: " + layout, e);
        }
    }

    private static int padWidth(String name, String aux) {
        try {
            return Integer.parseInt(aux.trim());
        } catch (NumberFormatException e) {
            throw new LogConfigurationException("invalid pad spec for " + FLAG_SEPARATOR + name + ": " + aux, e);
        }
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
