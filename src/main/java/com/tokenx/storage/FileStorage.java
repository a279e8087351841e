package com.tokenx.storage;

import com.tokenx.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class FileStorage {

    public static final String TEMP_SUFFIX = ".tmp";

    /**
     * Atomic write: write to .tmp file, then rename.
     */
    public static void writeAtomic(Path target, byte[] data) throws IOException {
        Path tmpFile = writeTemp(target, data);
        commitTemp(tmpFile, target);
    }

    public static void writeAtomic(Path target, String text) throws IOException {
        writeAtomic(target, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * First half of an atomic write, for callers that stage several files before renaming any.
     */
    public static Path writeTemp(Path target, byte[] data) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + TEMP_SUFFIX);
        Files.write(tmpFile, data);
        return tmpFile;
    }

    public static void commitTemp(Path tmpFile, Path target) throws IOException {
        try {
            Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Best-effort removal of a leftover temp file; failures are only logged.
     */
    public static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("[FileStorage] Could not delete " + path.getFileName() + ": " + e.getMessage());
            }
        }
    }
}
