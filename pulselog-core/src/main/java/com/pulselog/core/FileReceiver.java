package com.pulselog.core;

import com.pulselog.api.Entry;
import com.pulselog.api.FmtFlag;
import com.pulselog.api.LogConfigurationException;
import org.agrona.concurrent.EpochClock;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;

/**
 * <h1>File Receiver: A Rotating Log File</h1>
 *
 * <p>
 * Appends rendered lines to a file and rotates it according to one of the
 * {@link Rotation} modes.
 * </p>
 *
 * <h3>State Machine</h3>
 *
 * <pre>
 *   OPEN --(policy says rotate, same call)--> ROTATING --> OPEN (fresh file)
 *   OPEN --close()--> CLOSED (terminal)
 * </pre>
 *
 * <h3>Rotation Step</h3>
 * <ol>
 * <li>Close the current channel.</li>
 * <li>Rename the file to {@code <base>-<yyyy-MM-dd-HH-mm-ss.SSS><ext>} next to
 * it.</li>
 * <li>Open a fresh file at the original path and reset size, line and day
 * counters.</li>
 * </ol>
 * <p>
 * The policy check runs before the write, inside the receiver lock, so the
 * offending line is always the first line of the new generation. The
 * {@code ReceiverStats} are not touched by rotation: they count everything this
 * receiver ever wrote.
 * </p>
 */
public class FileReceiver extends AbstractReceiver {

    public static final String TYPE = "FILE";

    public static final String BACKUP_TIME_FORMAT = "yyyy-MM-dd-HH-mm-ss.SSS";

    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private static final OpenOption[] OPEN_OPTIONS = {
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND
    };

    private final Path path;
    private final byte rotation;
    private final long maxSize;
    private final long maxLines;
    private final EpochClock clock;
    private final ZoneId zone;
    private final DateTimeFormatter backupTimeFormat;

    // Guarded by lock
    private FileChannel channel;
    private ByteBuffer writeView;
    private long fileSize;
    private long lineCount;
    private long openDayStart;
    private long nextDayStart;
    private int rotations;

    /**
     * @param maxSize  byte limit per file, used by {@link Rotation#SIZE}
     * @param maxLines line limit per file, used by {@link Rotation#LINES}; 0 disables
     * @throws LogConfigurationException if a limit is out of range or the file
     *                                   cannot be opened
     */
    public FileReceiver(List<FlagPart> parts, Path path, byte rotation, long maxSize, long maxLines,
            EpochClock clock) {
        super(TYPE, parts);
        if (rotation == Rotation.SIZE) {
            if (maxSize > Rotation.MAX_SIZE_BYTES) {
                throw new LogConfigurationException("maximum 2GB file size supported for rotation");
            }
            if (maxSize <= 0) {
                throw new LogConfigurationException("rotate.size must be positive: " + maxSize);
            }
        }
        if (maxLines < 0) {
            throw new LogConfigurationException("rotate.lines must not be negative: " + maxLines);
        }

        this.path = path;
        this.rotation = rotation;
        this.maxSize = maxSize;
        this.maxLines = maxLines;
        this.clock = clock;
        this.zone = PatternCompiler.isFlagExists(parts, FmtFlag.UTC_TIME) ? ZoneOffset.UTC : ZoneId.systemDefault();
        this.backupTimeFormat = DateTimeFormatter.ofPattern(BACKUP_TIME_FORMAT).withZone(zone);

        try {
            openFile(clock.time());
        } catch (IOException e) {
            throw new LogConfigurationException("unable to open log file: " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    public byte rotation() {
        return rotation;
    }

    public long maxSize() {
        return maxSize;
    }

    public long maxLines() {
        return maxLines;
    }

    /**
     * @return bytes in the current file generation
     */
    public long fileSize() {
        lock.lock();
        try {
            return fileSize;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return lines written to the current file generation
     */
    public long lineCount() {
        lock.lock();
        try {
            return lineCount;
        } finally {
            lock.unlock();
        }
    }

    public int rotations() {
        lock.lock();
        try {
            return rotations;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void write(Entry entry, int length) throws IOException {
        long now = clock.time();
        if (isRotationDue(now, length)) {
            rotate(now);
        }

        ByteBuffer view = writeView();
        view.limit(length).position(0);
        while (view.hasRemaining()) {
            channel.write(view);
        }

        fileSize += length;
        lineCount++;
    }

    @Override
    protected void closeSink() throws IOException {
        channel.close();
    }

    private boolean isRotationDue(long now, int length) {
        switch (rotation) {
            case Rotation.DAILY:
                return now < openDayStart || now >= nextDayStart;
            case Rotation.SIZE:
                return fileSize > 0 && fileSize + length > maxSize;
            case Rotation.LINES:
                return maxLines > 0 && lineCount >= maxLines;
            default:
                return false;
        }
    }

    private void rotate(long now) throws IOException {
        channel.close();
        try {
            Files.move(path, backupPath(now));
        } finally {
            // Keep the receiver writable even if the rename failed
            openFile(now);
        }
        rotations++;
    }

    private void openFile(long now) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            FileAttribute<Set<PosixFilePermission>> permissions = PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS);
            channel = FileChannel.open(path, Set.of(OPEN_OPTIONS), permissions);
        } else {
            channel = FileChannel.open(path, OPEN_OPTIONS);
        }

        fileSize = channel.size();
        lineCount = 0;

        LocalDate day = Instant.ofEpochMilli(now).atZone(zone).toLocalDate();
        openDayStart = day.atStartOfDay(zone).toInstant().toEpochMilli();
        nextDayStart = day.plusDays(1).atStartOfDay(zone).toInstant().toEpochMilli();
    }

    Path backupPath(long now) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        String stamp = backupTimeFormat.format(Instant.ofEpochMilli(now));

        Path backup = path.resolveSibling(baseName + "-" + stamp + ext);
        for (int i = 1; Files.exists(backup); i++) {
            backup = path.resolveSibling(baseName + "-" + stamp + "-" + i + ext);
        }
        return backup;
    }

    // Re-wrapped only when the render buffer grew
    private ByteBuffer writeView() {
        byte[] bytes = buffer.byteArray();
        if (writeView == null || writeView.array() != bytes) {
            writeView = ByteBuffer.wrap(bytes);
        }
        return writeView;
    }
}
