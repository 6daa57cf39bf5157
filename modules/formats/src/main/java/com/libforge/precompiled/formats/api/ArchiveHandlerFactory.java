package com.libforge.precompiled.formats.api;

import java.nio.file.Path;

/**
 * Factory for creating archive handler instances.
 */
public interface ArchiveHandlerFactory {
    /**
     * Returns criteria for detecting when this handler should be used.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Creates a handler for the archive at the given path.
     */
    ArchiveHandler createInstance(Path archive);
}
