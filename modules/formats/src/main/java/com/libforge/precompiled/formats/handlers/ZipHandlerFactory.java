package com.libforge.precompiled.formats.handlers;

import com.libforge.precompiled.formats.ArchiveException;
import com.libforge.precompiled.formats.api.ArchiveEntry;
import com.libforge.precompiled.formats.api.ArchiveHandler;
import com.libforge.precompiled.formats.api.ArchiveHandlerFactory;
import com.libforge.precompiled.formats.api.DetectionCriteria;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;

/**
 * Handler for ZIP archives.
 */
public class ZipHandlerFactory implements ArchiveHandlerFactory {

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(Set.of(".zip"), 200);
    }

    @Override
    public ArchiveHandler createInstance(Path archive) {
        return new ZipHandler(archive);
    }

    private static class ZipHandler implements ArchiveHandler {
        private final Path archive;

        ZipHandler(Path archive) {
            this.archive = archive;
        }

        @Override
        public String formatName() {
            return "zip";
        }

        @Override
        public List<ArchiveEntry> extractEntries() {
            List<ArchiveEntry> entries = new ArrayList<>();

            try (ZipFile zipFile = ZipFile.builder().setPath(archive).get()) {
                Enumeration<ZipArchiveEntry> all = zipFile.getEntries();
                while (all.hasMoreElements()) {
                    ZipArchiveEntry entry = all.nextElement();
                    if (entry.isDirectory() || entry.isUnixSymlink()) {
                        continue;
                    }
                    try (InputStream in = zipFile.getInputStream(entry)) {
                        entries.add(new ArchiveEntry(entry.getName(), in.readAllBytes()));
                    }
                }
            } catch (IOException e) {
                throw new ArchiveException("Failed to read ZIP archive " + archive.getFileName(), e);
            }

            return entries;
        }
    }
}
