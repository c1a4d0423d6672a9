package com.pulselog.core;

import com.pulselog.api.Level;
import com.pulselog.api.LogConfigurationException;
import org.agrona.SystemUtil;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * <b>Composition Root for Loggers.</b>
 * <p>
 * Parses the configuration string, compiles the pattern and picks the receiver
 * variant. Everything that can be wrong with a configuration is detected here;
 * either a ready {@link Logger} comes back or a
 * {@link LogConfigurationException} is thrown and nothing is left open.
 * </p>
 *
 * <pre>
 *   Logger log = LoggerFactory.create("receiver = FILE\n"
 *           + "file = logs/app.log\n"
 *           + "rotate.mode = lines\n"
 *           + "rotate.lines = 100000");
 * </pre>
 */
public final class LoggerFactory {

    public static final String DEFAULT_LEVEL = "DEBUG";
    public static final String DEFAULT_FILE = "pulselog.log";
    public static final String DEFAULT_ROTATE_MODE = "daily";
    public static final int DEFAULT_ROTATE_SIZE_MB = 100;

    private LoggerFactory() {
    }

    public static Logger create(String config) {
        return create(config, SystemEpochClock.INSTANCE);
    }

    public static Logger create(String config, EpochClock clock) {
        if (config == null || config.isBlank()) {
            throw new LogConfigurationException("logger config is empty");
        }
        LogConfig cfg = LogConfig.parse(config);

        String receiverType = cfg.string("receiver");
        if (receiverType == null || receiverType.isEmpty()) {
            throw new LogConfigurationException("receiver configuration is required");
        }
        receiverType = receiverType.toUpperCase(Locale.ROOT);

        String levelName = cfg.stringDefault("level", DEFAULT_LEVEL);
        byte level = Level.byName(levelName);
        if (level == Level.UNKNOWN) {
            throw new LogConfigurationException("unrecognized log level: " + levelName);
        }

        List<FlagPart> parts = PatternCompiler.compile(cfg.stringDefault("pattern", PatternCompiler.DEFAULT_PATTERN));

        Receiver receiver;
        switch (receiverType) {
            case ConsoleReceiver.TYPE:
                receiver = newConsoleReceiver(cfg, parts);
                break;
            case FileReceiver.TYPE:
                receiver = newFileReceiver(cfg, parts, clock);
                break;
            default:
                throw new LogConfigurationException("unsupported receiver: " + receiverType);
        }

        return new Logger(receiver, level, PatternCompiler.isCallerInfoRequired(parts), clock);
    }

    static ConsoleReceiver newConsoleReceiver(LogConfig cfg, List<FlagPart> parts) {
        boolean color = cfg.boolDefault("color", true) && !SystemUtil.isWindows();
        return new ConsoleReceiver(parts, ConsoleReceiver.stderr(), color);
    }

    static FileReceiver newFileReceiver(LogConfig cfg, List<FlagPart> parts, EpochClock clock) {
        int maxSizeMb = cfg.intDefault("rotate.size", DEFAULT_ROTATE_SIZE_MB);
        if (maxSizeMb > Rotation.MAX_SIZE_MB) {
            throw new LogConfigurationException("maximum 2GB file size supported for rotation");
        }

        byte rotation = Rotation.byName(cfg.stringDefault("rotate.mode", DEFAULT_ROTATE_MODE));
        long maxSize = rotation == Rotation.SIZE ? maxSizeMb * 1024L * 1024L : 0;
        long maxLines = rotation == Rotation.LINES ? cfg.intDefault("rotate.lines", 0) : 0;
        Path file = Path.of(cfg.stringDefault("file", DEFAULT_FILE));

        return new FileReceiver(parts, file, rotation, maxSize, maxLines, clock);
    }
}
