package com.scenariomock.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Replaces a file so that readers see either the old or the new content, never a partial write.
 * Used by the file-backed record store and the match report.
 */
public final class AtomicFileWriter {

    private static final Logger logger = LoggerFactory.getLogger(AtomicFileWriter.class);

    private static final String TEMP_PREFIX = "scenariomock-";

    private AtomicFileWriter() {
        // utility class
    }

    /**
     * Writes {@code content} as UTF-8 to {@code target} atomically.
     */
    public static void writeString(Path target, String content) throws IOException {
        writeAtomically(target, tempPath -> Files.write(tempPath, content.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Creates a temp file next to {@code target}, lets {@code writer} fill it, forces it to disk and
     * moves it over the target. Falls back to a plain replace where the file system has no atomic
     * move. Missing parent directories are created.
     *
     * @throws IOException if writing or moving fails; the temp file is removed in that case
     */
    public static void writeAtomically(Path target, Writer writer) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent == null) {
            throw new IOException("Target file must have a parent directory for atomic write: " + target);
        }
        Files.createDirectories(parent);

        Path tempPath = Files.createTempFile(parent, TEMP_PREFIX, "-" + target.getFileName() + ".tmp");
        boolean moved = false;
        try {
            writer.write(tempPath);
            try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            try {
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, replacing non-atomically", target);
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
            syncDirectory(parent);
        } finally {
            if (!moved) {
                deleteQuietly(tempPath);
            }
        }
    }

    private static void syncDirectory(Path directory) {
        // Directory fsync is not available on every platform.
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            logger.debug("Could not sync directory {}: {}", directory, e.getMessage());
        }
    }

    private static void deleteQuietly(Path tempPath) {
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException e) {
            logger.warn("Failed to delete temp file {}: {}", tempPath, e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Writer {
        void write(Path tempPath) throws IOException;
    }
}
