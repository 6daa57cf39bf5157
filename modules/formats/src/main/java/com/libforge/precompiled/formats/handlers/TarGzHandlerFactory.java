package com.libforge.precompiled.formats.handlers;

import com.libforge.precompiled.formats.ArchiveException;
import com.libforge.precompiled.formats.api.ArchiveEntry;
import com.libforge.precompiled.formats.api.ArchiveHandler;
import com.libforge.precompiled.formats.api.ArchiveHandlerFactory;
import com.libforge.precompiled.formats.api.Codec;
import com.libforge.precompiled.formats.api.DetectionCriteria;
import com.libforge.precompiled.formats.codecs.GzipCodec;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handler for gzip-compressed TAR archives (.tar.gz, .tgz).
 * The gzip layer is peeled off by {@link GzipCodec}.
 */
public class TarGzHandlerFactory implements ArchiveHandlerFactory {

    private final Codec codec;

    public TarGzHandlerFactory() {
        this(new GzipCodec());
    }

    public TarGzHandlerFactory(Codec codec) {
        this.codec = codec;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(Set.of(".tar.gz", ".tgz"), 200);
    }

    @Override
    public ArchiveHandler createInstance(Path archive) {
        return new TarGzHandler(archive, codec);
    }

    private static class TarGzHandler implements ArchiveHandler {
        private final Path archive;
        private final Codec codec;

        TarGzHandler(Path archive, Codec codec) {
            this.archive = archive;
            this.codec = codec;
        }

        @Override
        public String formatName() {
            return "tar.gz";
        }

        @Override
        public List<ArchiveEntry> extractEntries() {
            List<ArchiveEntry> entries = new ArrayList<>();

            try (InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
                 InputStream decoded = codec.decode(raw);
                 TarArchiveInputStream tar = new TarArchiveInputStream(decoded)) {

                TarArchiveEntry entry;
                while ((entry = tar.getNextEntry()) != null) {
                    if (entry.isDirectory() || !entry.isFile()) {
                        continue;
                    }
                    entries.add(new ArchiveEntry(entry.getName(), tar.readAllBytes()));
                }

            } catch (IOException e) {
                throw new ArchiveException("Failed to read TAR.GZ archive " + archive.getFileName(), e);
            }

            return entries;
        }
    }
}
