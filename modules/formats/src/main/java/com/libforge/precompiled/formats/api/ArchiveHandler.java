package com.libforge.precompiled.formats.api;

import java.util.List;

/**
 * Decodes one archive.
 */
public interface ArchiveHandler {

    /**
     * Short format name used in messages, e.g. {@code "zip"}.
     */
    String formatName();

    /**
     * Decodes the archive once and returns its regular files in archive order.
     * Directories, symlinks and other special entries are skipped.
     *
     * @throws com.libforge.precompiled.formats.ArchiveException if the archive cannot be read
     */
    List<ArchiveEntry> extractEntries();
}
