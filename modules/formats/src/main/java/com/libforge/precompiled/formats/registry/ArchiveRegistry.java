package com.libforge.precompiled.formats.registry;

import com.libforge.precompiled.formats.UnsupportedArchiveException;
import com.libforge.precompiled.formats.api.ArchiveHandler;
import com.libforge.precompiled.formats.api.ArchiveHandlerFactory;
import com.libforge.precompiled.formats.handlers.TarGzHandlerFactory;
import com.libforge.precompiled.formats.handlers.ZipHandlerFactory;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Matches archive files to handler factories by file-name suffix.
 */
public class ArchiveRegistry {

    private final List<ArchiveHandlerFactory> factories;

    public ArchiveRegistry(List<ArchiveHandlerFactory> factories) {
        this.factories = List.copyOf(factories);
    }

    /**
     * Registry with the ZIP and TAR.GZ handlers.
     */
    public static ArchiveRegistry withDefaults() {
        return new ArchiveRegistry(List.of(new ZipHandlerFactory(), new TarGzHandlerFactory()));
    }

    /**
     * Finds the highest-priority factory whose suffixes match the file name.
     */
    public Optional<ArchiveHandlerFactory> findFactory(String filename) {
        return factories.stream()
                .filter(f -> f.getDetectionCriteria().matches(filename))
                .max(Comparator.comparingInt(f -> f.getDetectionCriteria().priority()));
    }

    /**
     * Creates a handler for the archive.
     *
     * @throws UnsupportedArchiveException if no factory recognizes the suffix
     */
    public ArchiveHandler handlerFor(Path archive) {
        String filename = archive.getFileName().toString();
        return findFactory(filename)
                .map(f -> f.createInstance(archive))
                .orElseThrow(() -> new UnsupportedArchiveException(filename));
    }
}
