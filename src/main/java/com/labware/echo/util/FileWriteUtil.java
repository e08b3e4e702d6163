package com.labware.echo.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Whole-file writes that never leave a partially written target behind.
 */
public class FileWriteUtil {

    private static final Logger log = LoggerFactory.getLogger(FileWriteUtil.class);

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a sibling temporary file, then moves it over the target,
     * creating parent directories if needed.
     *
     * A new file gets the process default permissions; an existing file keeps
     * its POSIX permissions.
     */
    public static void safeWrite(Path filePath, byte[] content) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parentDir = target.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Path temp = target.resolveSibling("." + target.getFileName() + ".tmp");
        Files.deleteIfExists(temp);
        try {
            Files.write(temp, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            copyPermissions(target, temp);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote {} bytes to {}", content.length, target);
    }

    public static void safeWriteString(Path filePath, String content) throws IOException {
        safeWrite(filePath, content.getBytes(StandardCharsets.UTF_8));
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from)) {
            return;
        }
        PosixFileAttributeView source = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        PosixFileAttributeView target = Files.getFileAttributeView(to, PosixFileAttributeView.class);
        if (source != null && target != null) {
            target.setPermissions(source.readAttributes().permissions());
        }
    }
}
