package com.pulselog.core;

import com.pulselog.api.Entry;
import com.pulselog.api.Level;
import org.agrona.ExpandableArrayBuffer;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes rendered lines to a terminal stream, the process's standard error by
 * default.
 * <p>
 * With colour enabled every line is wrapped in the ANSI colour of its level. The
 * escape bytes are decoration: {@code bytesWritten} counts the rendered line and
 * its terminator only, so console and file stats compare one to one.
 * </p>
 * <p>
 * The sink must report failures by throwing. A {@link java.io.PrintStream} never
 * throws and keeps its error flag set once tripped, so {@link #stderr()} goes to
 * the file descriptor directly. Each line, colour codes included, leaves in a
 * single {@code write} call and every call reports its own outcome.
 * </p>
 */
public class ConsoleReceiver extends AbstractReceiver {

    public static final String TYPE = "CONSOLE";

    static final byte[] RESET_COLOR = ansi("\033[0m");

    // Indexed by level
    static final byte[][] LEVEL_TO_COLOR = {
            ansi("\033[0;31m"), // ERROR
            ansi("\033[0;33m"), // WARN
            ansi("\033[0;37m"), // INFO
            ansi("\033[0;34m"), // DEBUG
            ansi("\033[0;35m"), // TRACE
    };

    private final OutputStream out;
    private final boolean color;

    // Line plus colour codes, reused under the receiver lock
    private final ExpandableArrayBuffer colorLine = new ExpandableArrayBuffer(256);

    public ConsoleReceiver(List<FlagPart> parts, OutputStream out, boolean color) {
        super(TYPE, parts);
        this.out = out;
        this.color = color;
    }

    public static OutputStream stderr() {
        return new FileOutputStream(FileDescriptor.err);
    }

    public boolean isColor() {
        return color;
    }

    @Override
    protected void write(Entry entry, int length) throws IOException {
        if (color && Level.isValid(entry.level)) {
            byte[] levelColor = LEVEL_TO_COLOR[entry.level];
            int index = 0;
            colorLine.putBytes(index, levelColor);
            index += levelColor.length;
            colorLine.putBytes(index, buffer, 0, length - 1);
            index += length - 1;
            colorLine.putBytes(index, RESET_COLOR);
            index += RESET_COLOR.length;
            colorLine.putByte(index++, LINE_TERMINATOR);
            out.write(colorLine.byteArray(), 0, index);
        } else {
            out.write(buffer.byteArray(), 0, length);
        }
        out.flush();
    }

    @Override
    protected void closeSink() throws IOException {
        // The stream belongs to the process; only flush it
        out.flush();
    }

    private static byte[] ansi(String code) {
        return code.getBytes(StandardCharsets.US_ASCII);
    }
}
