package com.libforge.precompiled.formats.extract;

import com.libforge.precompiled.formats.ArchiveException;
import com.libforge.precompiled.formats.LibraryNotFoundInArchiveException;
import com.libforge.precompiled.formats.api.ArchiveEntry;
import com.libforge.precompiled.formats.api.ArchiveHandler;
import com.libforge.precompiled.formats.registry.ArchiveRegistry;
import com.libforge.precompiled.types.Reporter;
import com.libforge.precompiled.util.AtomicFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Pulls the shared library out of a verified artifact archive.
 *
 * <p>The output directory is keyed by build id and target triple. Once it holds a
 * file with the expected extension, later calls return that file without
 * decoding the archive again.
 */
public class LibraryExtractor {

    /** Directory segment that conventionally holds the library output. */
    static final String LIBRARY_DIR_SEGMENT = "lib";

    private final ArchiveRegistry registry;

    public LibraryExtractor() {
        this(ArchiveRegistry.withDefaults());
    }

    public LibraryExtractor(ArchiveRegistry registry) {
        this.registry = registry;
    }

    /**
     * Extracts the library with {@code expectedExtension} (e.g. {@code ".so"}) from
     * {@code archive} into {@code outputDir}.
     *
     * @throws com.libforge.precompiled.formats.UnsupportedArchiveException for unknown archive suffixes
     * @throws LibraryNotFoundInArchiveException if no entry has the extension
     * @throws ArchiveException on I/O failure
     */
    public Path extractLibrary(Path archive, String expectedExtension, Path outputDir, Reporter reporter) {
        Optional<Path> existing = findExisting(outputDir, expectedExtension);
        if (existing.isPresent()) {
            reporter.debugf("Reusing extracted library %s", existing.get());
            return existing.get();
        }

        ArchiveHandler handler = registry.handlerFor(archive);
        List<ArchiveEntry> entries = handler.extractEntries();
        reporter.debugf("Decoded %s archive %s (%d files)",
                handler.formatName(), archive.getFileName(), entries.size());

        ArchiveEntry entry = selectLibraryEntry(entries, expectedExtension)
                .orElseThrow(() -> new LibraryNotFoundInArchiveException(
                        archive.getFileName().toString(), expectedExtension));

        Path target = outputDir.resolve(entry.fileName());
        try {
            AtomicFiles.write(target, entry.data());
        } catch (IOException e) {
            throw new ArchiveException("Failed to write extracted library " + target, e);
        }
        reporter.debugf("Extracted %s to %s", entry.path(), target);
        return target;
    }

    /**
     * Prefers an entry under a {@code lib} directory; otherwise the first entry with
     * the extension.
     */
    static Optional<ArchiveEntry> selectLibraryEntry(List<ArchiveEntry> entries, String expectedExtension) {
        ArchiveEntry fallback = null;
        for (ArchiveEntry entry : entries) {
            if (!entry.extension().equals(expectedExtension)) {
                continue;
            }
            if (entry.segments().contains(LIBRARY_DIR_SEGMENT)) {
                return Optional.of(entry);
            }
            if (fallback == null) {
                fallback = entry;
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static Optional<Path> findExisting(Path dir, String expectedExtension) {
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> !AtomicFiles.isTempFile(p))
                    .filter(p -> ArchiveEntry.extensionOf(p.getFileName().toString()).equals(expectedExtension))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            throw new ArchiveException("Failed to list extraction directory " + dir, e);
        }
    }
}
