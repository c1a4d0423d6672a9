package com.pulselog.core;

import com.pulselog.api.Entry;
import com.pulselog.api.ReceiverStats;
import com.pulselog.api.WriterClosedException;
import org.agrona.ExpandableArrayBuffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <b>Receiver Base: One Lock, One Buffer.</b>
 * <p>
 * Holds everything the concrete receivers share: the compiled pattern, the
 * stats, the closed flag and the write path.
 * </p>
 *
 * <h3>Design Rationality:</h3>
 * <ol>
 * <li><b>Single Critical Section:</b> Rendering, the sink-specific pre-write
 * checks (file rotation) and the write itself all run under one
 * {@link ReentrantLock}. A rotation decision can never go stale between check
 * and write, and two lines can never interleave.</li>
 * <li><b>Reused Buffer:</b> The rendered line is encoded into a single Agrona
 * {@link ExpandableArrayBuffer} owned by this receiver. Since it is only touched
 * inside the lock, one buffer is enough; it grows to the longest line seen and
 * stays there.</li>
 * <li><b>Closed Is Final:</b> {@code closed} flips once, under the lock, so no
 * write starts after it is visible. It is volatile so {@link #isClosed()}
 * never blocks behind a slow write.</li>
 * </ol>
 */
public abstract class AbstractReceiver implements Receiver {

    protected static final byte LINE_TERMINATOR = '\n';

    protected final ReentrantLock lock = new ReentrantLock();
    protected final ReceiverStats stats = new ReceiverStats();
    protected final ExpandableArrayBuffer buffer = new ExpandableArrayBuffer(256);

    private final PatternFormatter formatter;
    private final String type;
    private volatile boolean closed;

    protected AbstractReceiver(String type, List<FlagPart> parts) {
        this.type = type;
        this.formatter = new PatternFormatter(parts);
    }

    @Override
    public final void output(Entry entry) throws IOException {
        lock.lock();
        try {
            if (closed) {
                throw new WriterClosedException();
            }
            int length = encode(formatter.render(entry));
            write(entry, length);
            stats.record(length);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            closeSink();
        } catch (IOException e) {
            throw new UncheckedIOException("unable to close " + type + " receiver", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public ReceiverStats stats() {
        return stats;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public List<FlagPart> parts() {
        return formatter.parts();
    }

    /**
     * Writes {@code buffer[0, length)} to the sink. Called with the lock held;
     * the last byte is the line terminator.
     */
    protected abstract void write(Entry entry, int length) throws IOException;

    protected abstract void closeSink() throws IOException;

    private int encode(CharSequence line) {
        int length = buffer.putStringWithoutLengthUtf8(0, line.toString());
        buffer.putByte(length, LINE_TERMINATOR);
        return length + 1;
    }
}
