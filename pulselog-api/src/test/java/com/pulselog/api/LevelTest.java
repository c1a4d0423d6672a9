package com.pulselog.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LevelTest {

    @Test
    void shouldOrderBySeverity() {
        assertTrue(Level.ERROR < Level.WARN);
        assertTrue(Level.WARN < Level.INFO);
        assertTrue(Level.INFO < Level.DEBUG);
        assertTrue(Level.DEBUG < Level.TRACE);
    }

    @Test
    void shouldLookUpNamesIgnoringCase() {
        assertEquals(Level.ERROR, Level.byName("error"));
        assertEquals(Level.WARN, Level.byName(" Warn "));
        assertEquals(Level.TRACE, Level.byName("TRACE"));
        assertEquals(Level.UNKNOWN, Level.byName("FATAL"));
        assertEquals(Level.UNKNOWN, Level.byName(null));
    }

    @Test
    void shouldNameEveryLevel() {
        for (byte level = Level.ERROR; level <= Level.TRACE; level++) {
            assertTrue(Level.isValid(level));
            assertEquals(level, Level.byName(Level.name(level)));
        }
        assertEquals("Unknown", Level.name(Level.UNKNOWN));
        assertEquals("Unknown", Level.name((byte) -1));
        assertFalse(Level.isValid(Level.UNKNOWN));
    }

    @Test
    void shouldLookUpFormatFlags() {
        assertEquals(FmtFlag.UTC_TIME, FmtFlag.byName("utctime"));
        assertEquals(FmtFlag.UNKNOWN, FmtFlag.byName("thread"));
        assertTrue(FmtFlag.isCallerFlag(FmtFlag.LINE));
        assertTrue(FmtFlag.isCallerFlag(FmtFlag.LONG_FILE));
        assertFalse(FmtFlag.isCallerFlag(FmtFlag.MESSAGE));
    }

    @Test
    void shouldCountLinesAndBytes() {
        ReceiverStats stats = new ReceiverStats();
        stats.record(11);
        stats.record(5);

        assertEquals(2, stats.linesWritten());
        assertEquals(16, stats.bytesWritten());
    }
}
