package com.libforge.precompiled.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Write-to-temp-then-rename helpers.
 *
 * <p>Readers sharing the directory either see the complete file or no file.
 * Temp files live next to the target so the rename never crosses file systems.
 */
public final class AtomicFiles {

    private static final String TEMP_SUFFIX = ".part";

    private AtomicFiles() {
    }

    public static void write(Path target, byte[] data) throws IOException {
        Path temp = createTemp(target);
        try {
            Files.write(temp, data);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public static void write(Path target, InputStream in) throws IOException {
        Path temp = createTemp(target);
        try {
            Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Deletes each path that exists. Returns how many were removed.
     */
    public static int deleteAll(Path... paths) throws IOException {
        int removed = 0;
        for (Path path : paths) {
            if (Files.deleteIfExists(path)) {
                removed++;
            }
        }
        return removed;
    }

    public static boolean isTempFile(Path path) {
        return path.getFileName().toString().endsWith(TEMP_SUFFIX);
    }

    private static Path createTemp(Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        return Files.createTempFile(dir, "." + target.getFileName() + "-", TEMP_SUFFIX);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
