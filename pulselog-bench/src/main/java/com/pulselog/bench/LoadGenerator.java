package com.pulselog.bench;

import com.pulselog.core.Logger;
import com.pulselog.core.LoggerFactory;
import com.pulselog.core.WarmupService;

import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Performance Testing Tool.
 * Hammers one file receiver from many threads and measures per-call latency.
 *
 * <pre>
 *   LoadGenerator [threads] [linesPerThread] [file]
 * </pre>
 */
public class LoadGenerator {

    public static void main(String[] args) {
        int threads = 8;
        int linesPerThread = 100_000;
        String file = "bench/pulselog-bench.log";
        try {
            if (args.length > 0) {
                threads = Integer.parseInt(args[0]);
            }
            if (args.length > 1) {
                linesPerThread = Integer.parseInt(args[1]);
            }
        } catch (NumberFormatException e) {
            System.err.println("Invalid argument, defaulting to " + threads + " threads x " + linesPerThread + " lines");
        }
        if (args.length > 2) {
            file = args[2];
        }

        System.out.println("Starting Load Generator: " + threads + " threads x " + linesPerThread + " lines -> " + file);

        try (Logger logger = LoggerFactory.create("receiver = FILE\n"
                + "level = INFO\n"
                + "file = " + file + "\n"
                + "rotate.mode = size\n"
                + "rotate.size = 64")) {

            new WarmupService().warmup(logger.receiver().parts());

            Result result = run(logger, threads, linesPerThread);
            print(result);
            System.out.println("Stats: " + logger.stats());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
        }
    }

    /**
     * Runs {@code threads} writers released at the same instant, each logging
     * {@code linesPerThread} lines.
     */
    public static Result run(Logger logger, int threads, int linesPerThread) throws InterruptedException {
        long[][] latencies = new long[threads][linesPerThread];
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            final int id = t;
            Thread writer = new Thread(() -> {
                long[] mine = latencies[id];
                ready.countDown();
                try {
                    go.await();
                    for (int i = 0; i < linesPerThread; i++) {
                        long start = System.nanoTime();
                        logger.infof("writer=%d seq=%d payload=%s", id, i, "abcdefghijklmnopqrstuvwxyz");
                        mine[i] = System.nanoTime() - start;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }, "writer-" + t);
            writer.start();
        }

        ready.await();
        long start = System.currentTimeMillis();
        go.countDown();
        done.await();
        long end = System.currentTimeMillis();

        long[] all = new long[threads * linesPerThread];
        for (int t = 0; t < threads; t++) {
            System.arraycopy(latencies[t], 0, all, t * linesPerThread, linesPerThread);
        }
        Arrays.sort(all);
        return new Result(all.length, Math.max(end - start, 1), all);
    }

    private static void print(Result result) {
        System.out.println("Done. Throughput: " + result.throughput() + " lines/sec");
        System.out.println("Latency (ns):");
        System.out.println("p50:   " + result.percentile(0.50));
        System.out.println("p99:   " + result.percentile(0.99));
        System.out.println("p99.9: " + result.percentile(0.999));
        System.out.println("Max:   " + result.max());
    }

    public static final class Result {
        public final int lines;
        public final long elapsedMillis;
        private final long[] sortedLatencies;

        Result(int lines, long elapsedMillis, long[] sortedLatencies) {
            this.lines = lines;
            this.elapsedMillis = elapsedMillis;
            this.sortedLatencies = sortedLatencies;
        }

        public double throughput() {
            return lines / (elapsedMillis / 1000.0);
        }

        public long percentile(double p) {
            if (sortedLatencies.length == 0) {
                return 0;
            }
            return sortedLatencies[(int) Math.min(sortedLatencies.length - 1, sortedLatencies.length * p)];
        }

        public long max() {
            return sortedLatencies.length == 0 ? 0 : sortedLatencies[sortedLatencies.length - 1];
        }
    }
}
