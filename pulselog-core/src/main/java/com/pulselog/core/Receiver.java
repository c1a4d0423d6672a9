package com.pulselog.core;

import com.pulselog.api.Entry;
import com.pulselog.api.ReceiverStats;

import java.io.IOException;
import java.util.List;

/**
 * The sink-owning side of a logger.
 * <p>
 * A receiver renders entries through its compiled pattern, writes them to its
 * sink and enforces its own lifecycle. Implementations are selected once when
 * the logger is built and must be safe for concurrent {@link #output(Entry)}
 * calls: lines are never interleaved.
 * </p>
 */
public interface Receiver {

    /**
     * Renders and writes the entry plus a line terminator. The entry is only
     * read during the call and must not be retained.
     *
     * @throws com.pulselog.api.WriterClosedException if called after {@link #close()}
     * @throws IOException                            if the sink rejects the write
     */
    void output(Entry entry) throws IOException;

    /**
     * Closes the sink. Idempotent. No output is in flight once this returns.
     */
    void close();

    boolean isClosed();

    ReceiverStats stats();

    /**
     * @return the compiled pattern this receiver renders with
     */
    List<FlagPart> parts();

    /**
     * @return {@code CONSOLE} or {@code FILE}
     */
    String type();
}
