package com.tokenx;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Process-wide vault log. Lines go to the log file and, in dev mode, to the console.
 *
 * Callers never pass passwords or codes. As a backstop, otpauth {@code secret=} parameters are
 * masked in every line before it is written.
 */
public class AppLogger {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    static final long ROLLOVER_BYTES = 5L * 1024 * 1024;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern SECRET_PARAM = Pattern.compile("(?i)(secret=)[^&\\s\"]+");

    private static AppLogger instance;

    private final PrintStream file;
    private final PrintStream console;
    private final boolean consoleEnabled;
    private final Level threshold;

    private AppLogger(Path logFile, boolean consoleEnabled) throws IOException {
        this.console = System.out;
        this.consoleEnabled = consoleEnabled;
        this.threshold = consoleEnabled ? Level.DEBUG : Level.INFO;

        if (logFile.getParent() != null) {
            Files.createDirectories(logFile.getParent());
        }
        rollOver(logFile);
        this.file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);

        file.println();
        file.println("-".repeat(60));
        file.println("TokenX session log opened " + LocalDateTime.now().format(TIMESTAMP));
        file.println("-".repeat(60));
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled);
        }
    }

    /**
     * The shared logger, or null before {@link #initialize} (unit tests run without one).
     */
    public static AppLogger get() {
        return instance;
    }

    public void debug(String message) {
        write(Level.DEBUG, message);
    }

    public void info(String message) {
        write(Level.INFO, message);
    }

    public void warn(String message) {
        write(Level.WARN, message);
    }

    public void error(String message) {
        write(Level.ERROR, message);
    }

    public void error(String message, Throwable t) {
        write(Level.ERROR, message + " (" + t.getClass().getSimpleName() + ")");
        synchronized (this) {
            t.printStackTrace(file);
            if (consoleEnabled) {
                t.printStackTrace(console);
            }
        }
    }

    /**
     * Unformatted line for the startup banner; printed to the console and kept in the file.
     */
    public synchronized void console(String message) {
        console.println(message);
        file.println(message);
    }

    public synchronized void close() {
        file.close();
    }

    static String redact(String message) {
        if (message == null) {
            return "null";
        }
        return SECRET_PARAM.matcher(message).replaceAll("$1***");
    }

    private synchronized void write(Level level, String message) {
        if (level.ordinal() < threshold.ordinal()) {
            return;
        }
        String line = "[" + LocalDateTime.now().format(TIMESTAMP) + "] [" + level + "] " + redact(message);
        file.println(line);
        if (consoleEnabled) {
            console.println(line);
        }
    }

    private static void rollOver(Path logFile) throws IOException {
        if (Files.isRegularFile(logFile) && Files.size(logFile) > ROLLOVER_BYTES) {
            Path previous = logFile.resolveSibling(logFile.getFileName() + ".1");
            Files.move(logFile, previous, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
