package com.pulselog.core;

import com.pulselog.api.Entry;
import com.pulselog.api.Level;
import com.pulselog.api.LogConfigurationException;
import com.pulselog.api.WriterClosedException;
import org.agrona.concurrent.CachedEpochClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileReceiverTest {

    private static final List<FlagPart> MESSAGE_ONLY = PatternCompiler.compile("%message");

    // 10 chars + terminator
    private static final String TEN = "0123456789";

    @TempDir
    Path dir;

    private Path file;
    private CachedEpochClock clock;
    private FileReceiver receiver;

    @BeforeEach
    void setUp() {
        file = dir.resolve("app.log");
        clock = new CachedEpochClock();
        clock.update(millis(2024, 6, 10, 12, 0, 0));
    }

    @AfterEach
    void tearDown() {
        if (receiver != null) {
            receiver.close();
        }
    }

    private static long millis(int year, int month, int day, int hour, int minute, int second) {
        return LocalDateTime.of(year, month, day, hour, minute, second)
                .atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }

    private static Entry entry(Object... values) {
        Entry entry = new Entry();
        entry.level = Level.INFO;
        entry.values = values;
        return entry;
    }

    private Entry stamped(Object... values) {
        Entry entry = entry(values);
        entry.time = clock.time();
        return entry;
    }

    private List<Path> backups() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("app-"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static List<String> lines(Path path) throws IOException {
        return Files.readAllLines(path, StandardCharsets.UTF_8);
    }

    @Test
    void shouldAppendLinesWithoutRotation() throws IOException {
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.NONE, 0, 0, clock);

        for (int i = 0; i < 5; i++) {
            receiver.output(entry("line ", i));
        }

        assertEquals(List.of("line 0", "line 1", "line 2", "line 3", "line 4"), lines(file));
        assertEquals(5, receiver.stats().linesWritten());
        assertEquals(35, receiver.stats().bytesWritten());
        assertEquals(35, receiver.fileSize());
        assertTrue(backups().isEmpty());
    }

    @Test
    void shouldRotateBySizeBeforeTheOffendingWrite() throws IOException {
        // Exactly four lines fit
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.SIZE, 44, 0, clock);

        for (int i = 0; i < 4; i++) {
            receiver.output(entry(TEN));
        }
        assertEquals(0, receiver.rotations());
        assertEquals(44, receiver.fileSize());

        receiver.output(entry(TEN));

        assertEquals(1, receiver.rotations());
        assertEquals(11, receiver.fileSize());
        assertEquals(1, lines(file).size());

        List<Path> backups = backups();
        assertEquals(1, backups.size());
        assertEquals(44, Files.size(backups.get(0)));

        // Stats are cumulative across generations
        assertEquals(5, receiver.stats().linesWritten());
        assertEquals(55, receiver.stats().bytesWritten());
    }

    @Test
    void shouldNotRotateAnEmptyFileForAnOversizedLine() throws IOException {
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.SIZE, 5, 0, clock);

        receiver.output(entry(TEN));

        assertEquals(0, receiver.rotations());
        assertEquals(11, receiver.fileSize());
    }

    @Test
    void shouldRotateAfterConfiguredLineCount() throws IOException {
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.LINES, 0, 3, clock);

        for (int i = 1; i <= 3; i++) {
            receiver.output(entry("line ", i));
        }
        assertEquals(0, receiver.rotations());
        assertEquals(3, receiver.lineCount());

        // The 4th line opens a new generation
        receiver.output(entry("line ", 4));
        assertEquals(1, receiver.rotations());
        assertEquals(1, receiver.lineCount());
        assertEquals(List.of("line 4"), lines(file));

        for (int i = 5; i <= 7; i++) {
            receiver.output(entry("line ", i));
        }
        assertEquals(2, receiver.rotations());
        assertEquals(List.of("line 7"), lines(file));
        assertEquals(7, receiver.stats().linesWritten());

        // Same instant on the clock: names are made unique
        List<Path> backups = backups();
        assertEquals(2, backups.size());
        assertEquals("app-2024-06-10-12-00-00.000.log", backups.get(0).getFileName().toString());
        assertEquals("app-2024-06-10-12-00-00.000-1.log", backups.get(1).getFileName().toString());
    }

    @Test
    void shouldRotateDailyOnCalendarDayChangeOnly() throws IOException {
        clock.update(millis(2024, 6, 10, 0, 0, 1));
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.DAILY, 0, 0, clock);

        receiver.output(entry("early"));

        // Almost a full day later, still the same calendar day
        clock.update(millis(2024, 6, 10, 23, 59, 59));
        receiver.output(entry("late"));
        assertEquals(0, receiver.rotations());

        // Two seconds later it is tomorrow
        clock.advance(2_000);
        receiver.output(entry("tomorrow"));

        assertEquals(1, receiver.rotations());
        assertEquals(List.of("tomorrow"), lines(file));

        List<Path> backups = backups();
        assertEquals(1, backups.size());
        assertEquals("app-2024-06-11-00-00-01.000.log", backups.get(0).getFileName().toString());
        assertEquals(List.of("early", "late"), lines(backups.get(0)));
    }

    @Test
    void shouldRotateOnUtcMidnightWhenPatternUsesUtcTime() throws IOException {
        List<FlagPart> parts = PatternCompiler.compile("%utctime:HH:mm:ss %message");
        clock.update(Instant.parse("2024-06-10T23:59:58Z").toEpochMilli());
        receiver = new FileReceiver(parts, file, Rotation.DAILY, 0, 0, clock);

        receiver.output(stamped("before"));
        clock.update(Instant.parse("2024-06-10T23:59:59.999Z").toEpochMilli());
        receiver.output(stamped("still today"));
        assertEquals(0, receiver.rotations());

        clock.update(Instant.parse("2024-06-11T00:00:00.001Z").toEpochMilli());
        receiver.output(stamped("after"));

        assertEquals(1, receiver.rotations());
        assertEquals(List.of("00:00:00 after"), lines(file));

        List<Path> backups = backups();
        assertEquals(1, backups.size());
        assertEquals("app-2024-06-11-00-00-00.001.log", backups.get(0).getFileName().toString());
        assertEquals(List.of("23:59:58 before", "23:59:59 still today"), lines(backups.get(0)));
    }

    @Test
    void shouldAppendToExistingFileAndCountItsSize() throws IOException {
        Files.writeString(file, "previous run\n");
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.SIZE, 20, 0, clock);
        assertEquals(13, receiver.fileSize());

        receiver.output(entry(TEN)); // 13 + 11 > 20

        assertEquals(1, receiver.rotations());
        assertEquals(List.of(TEN), lines(file));
    }

    @Test
    void shouldRejectWritesAfterClose() throws IOException {
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.NONE, 0, 0, clock);
        receiver.output(entry("kept"));

        receiver.close();

        assertTrue(receiver.isClosed());
        assertThrows(WriterClosedException.class, () -> receiver.output(entry("dropped")));
        assertThrows(WriterClosedException.class, () -> receiver.output(entry("dropped")));
        assertEquals(1, receiver.stats().linesWritten());
        assertEquals(5, receiver.stats().bytesWritten());
        assertEquals(List.of("kept"), lines(file));
    }

    @Test
    void shouldFailConstructionWhenFileCannotBeOpened() {
        // A directory is not a writable file
        assertThrows(LogConfigurationException.class,
                () -> new FileReceiver(MESSAGE_ONLY, dir, Rotation.NONE, 0, 0, clock));
    }

    @Test
    void shouldRejectSizeAboveTwoGigabytes() {
        LogConfigurationException e = assertThrows(LogConfigurationException.class,
                () -> new FileReceiver(MESSAGE_ONLY, file, Rotation.SIZE, Rotation.MAX_SIZE_BYTES + 1, 0, clock));
        assertEquals("maximum 2GB file size supported for rotation", e.getMessage());
    }

    @Test
    void shouldCreateMissingParentDirectories() throws IOException {
        Path nested = dir.resolve("a/b/c/app.log");
        receiver = new FileReceiver(MESSAGE_ONLY, nested, Rotation.NONE, 0, 0, clock);

        receiver.output(entry("deep"));

        assertEquals(List.of("deep"), lines(nested));
    }

    @Test
    void shouldSerializeConcurrentWriters() throws Exception {
        receiver = new FileReceiver(MESSAGE_ONLY, file, Rotation.NONE, 0, 0, clock);
        int threads = 100;
        int writes = 100;
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int id = t;
            Thread worker = new Thread(() -> {
                try {
                    go.await();
                    for (int i = 0; i < writes; i++) {
                        receiver.output(entry("thread=", id, " seq=", i, " payload=xxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxx"));
                    }
                } catch (Throwable e) {
                    failure.compareAndSet(null, e);
                } finally {
                    done.countDown();
                }
            });
            workers.add(worker);
            worker.start();
        }

        go.countDown();
        done.await();

        assertNull(failure.get());
        assertEquals(10_000, receiver.stats().linesWritten());

        List<String> lines = lines(file);
        assertEquals(10_000, lines.size());
        Pattern wellFormed = Pattern.compile("thread=\\d+ seq=\\d+ payload=x{38}");
        for (String line : lines) {
            assertTrue(wellFormed.matcher(line).matches(), "Corrupted line: " + line);
        }
        assertEquals(Files.size(file), receiver.stats().bytesWritten());
    }
}
