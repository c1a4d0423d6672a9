package com.pulselog.core;

import com.pulselog.api.Entry;
import com.pulselog.api.Level;
import com.pulselog.api.ReceiverStats;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * <h1>The Logger Facade</h1>
 *
 * <p>
 * Owns a level threshold and a {@link Receiver}. Each level has a values form
 * ({@code info("user ", id, " logged in")}) and a template form
 * ({@code infof("user %s logged in", id)}).
 * </p>
 *
 * <h2>The Hot Path</h2>
 * <ol>
 * <li><b>Filter:</b> {@code level > threshold} returns before anything else
 * happens. Filtered calls cost a byte comparison and the varargs array.</li>
 * <li><b>Borrow:</b> An {@link Entry} comes from the shared {@link ObjectPool}
 * instead of the heap.</li>
 * <li><b>Caller:</b> The stack is walked only if the pattern renders
 * {@code %longfile}, {@code %shortfile} or {@code %line}. Stack walking is by
 * far the most expensive step, so patterns without them skip it entirely.</li>
 * <li><b>Dispatch &amp; Return:</b> The receiver renders and writes; the entry goes
 * back to the pool after the receiver returns, whatever the outcome.</li>
 * </ol>
 *
 * <h2>Errors</h2>
 * <p>
 * {@link #output(Entry)} throws the receiver's {@link IOException}. The level
 * methods rethrow it as {@link UncheckedIOException} so call sites are not
 * forced into try/catch, but a failed write is never silently lost.
 * </p>
 */
public class Logger implements AutoCloseable {

    // captureCaller -> log -> info/Log.info -> caller
    private static final int CALLER_DEPTH = 3;

    private static final StackWalker WALKER = StackWalker.getInstance();

    private static final ObjectPool<Entry> ENTRY_POOL = new ObjectPool<>(1024, Entry::new, Entry::reset);

    private final Receiver receiver;
    private final byte level;
    private final boolean callerInfo;
    private final EpochClock clock;

    public Logger(Receiver receiver, byte level, boolean callerInfo) {
        this(receiver, level, callerInfo, SystemEpochClock.INSTANCE);
    }

    public Logger(Receiver receiver, byte level, boolean callerInfo, EpochClock clock) {
        if (!Level.isValid(level)) {
            throw new IllegalArgumentException("Invalid level: " + level);
        }
        this.receiver = receiver;
        this.level = level;
        this.callerInfo = callerInfo;
        this.clock = clock;
    }

    public void error(Object... values) {
        log(Level.ERROR, null, values);
    }

    public void errorf(String format, Object... values) {
        log(Level.ERROR, format, values);
    }

    public void warn(Object... values) {
        log(Level.WARN, null, values);
    }

    public void warnf(String format, Object... values) {
        log(Level.WARN, format, values);
    }

    public void info(Object... values) {
        log(Level.INFO, null, values);
    }

    public void infof(String format, Object... values) {
        log(Level.INFO, format, values);
    }

    public void debug(Object... values) {
        log(Level.DEBUG, null, values);
    }

    public void debugf(String format, Object... values) {
        log(Level.DEBUG, format, values);
    }

    public void trace(Object... values) {
        log(Level.TRACE, null, values);
    }

    public void tracef(String format, Object... values) {
        log(Level.TRACE, format, values);
    }

    /**
     * Writes a caller-built entry straight to the receiver. No level filtering
     * and no caller capture; the caller keeps ownership of the entry.
     */
    public void output(Entry entry) throws IOException {
        receiver.output(entry);
    }

    @Override
    public void close() {
        receiver.close();
    }

    public boolean isClosed() {
        return receiver.isClosed();
    }

    public ReceiverStats stats() {
        return receiver.stats();
    }

    public byte level() {
        return level;
    }

    public boolean isLevelEnabled(byte level) {
        return level <= this.level;
    }

    public Receiver receiver() {
        return receiver;
    }

    static ObjectPool<Entry> entryPool() {
        return ENTRY_POOL;
    }

    // Every public entry point must reach this method in exactly one frame
    void log(byte level, String format, Object[] values) {
        if (level > this.level) {
            return;
        }

        Entry entry = ENTRY_POOL.acquire();
        try {
            entry.level = level;
            entry.time = clock.time();
            entry.format = format;
            if (values != null) {
                entry.values = values;
            }
            if (callerInfo) {
                captureCaller(entry);
            }
            receiver.output(entry);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            ENTRY_POOL.release(entry);
        }
    }

    private void captureCaller(Entry entry) {
        Optional<StackWalker.StackFrame> frame = WALKER.walk(frames -> frames.skip(CALLER_DEPTH).findFirst());
        if (frame.isPresent()) {
            StackWalker.StackFrame caller = frame.get();
            entry.className = caller.getClassName();
            entry.file = caller.getFileName();
            entry.line = Math.max(caller.getLineNumber(), 0);
        } else {
            entry.file = PatternFormatter.UNKNOWN_FILE;
            entry.line = 0;
        }
    }
}
