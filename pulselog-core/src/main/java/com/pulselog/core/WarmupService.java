package com.pulselog.core;

import com.pulselog.api.Level;

import java.io.OutputStream;
import java.util.List;

/**
 * Runs the render and write path through a throwaway logger so the JIT has
 * compiled it before the first latency-sensitive log call.
 * <p>
 * The JVM optimizes the code, not the instance: the warm logger writes into a
 * discarding stream and is dropped afterwards, the real receiver never sees a
 * warm-up line.
 * </p>
 */
public class WarmupService {

    public static final int WARMUP_ITERATIONS = 200_000;

    /**
     * @return lines rendered by the throwaway logger
     */
    public long warmup(List<FlagPart> parts, int iterations) {
        System.out.println("WARMUP: Starting JIT compilation cycles (" + iterations + ")...");
        long start = System.nanoTime();

        Logger warmLogger = new Logger(new ConsoleReceiver(parts, OutputStream.nullOutputStream(), false), Level.TRACE,
                PatternCompiler.isCallerInfoRequired(parts));

        for (int i = 0; i < iterations; i++) {
            warmLogger.info("warmup ", i, " of ", iterations);

            // Template path and the less common levels
            if (i % 100 == 0) {
                warmLogger.debugf("warmup %d/%d", i, iterations);
                warmLogger.trace(i, i + 1);
            }
        }

        long lines = warmLogger.stats().linesWritten();
        warmLogger.close();

        long end = System.nanoTime();
        System.out.println("WARMUP: Completed in " + (end - start) / 1_000_000 + "ms. JIT should be hot.");
        return lines;
    }

    public long warmup(List<FlagPart> parts) {
        return warmup(parts, WARMUP_ITERATIONS);
    }
}
