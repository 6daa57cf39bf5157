package com.libforge.precompiled.formats.api;

import java.util.Arrays;
import java.util.List;

/**
 * A regular file decoded from an archive.
 *
 * @param path  entry path as stored in the archive, {@code /}-separated
 * @param data  uncompressed file content
 */
public record ArchiveEntry(String path, byte[] data) {

    /**
     * Path segments. Backslashes count as separators.
     */
    public List<String> segments() {
        return Arrays.asList(normalizedPath().split("/"));
    }

    /**
     * Last path segment.
     */
    public String fileName() {
        String normalized = normalizedPath();
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    /**
     * Extension of the last path segment including the dot, or empty when there is none.
     * A leading dot alone does not count as an extension.
     */
    public String extension() {
        return extensionOf(fileName());
    }

    private String normalizedPath() {
        return path.replace('\\', '/');
    }

    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot) : "";
    }
}
