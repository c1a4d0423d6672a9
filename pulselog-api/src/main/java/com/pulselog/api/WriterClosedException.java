package com.pulselog.api;

import java.io.IOException;

/**
 * Raised for every write attempted after the receiver was closed.
 */
public class WriterClosedException extends IOException {

    public static final String MESSAGE = "log writer is closed";

    public WriterClosedException() {
        super(MESSAGE);
    }
}
