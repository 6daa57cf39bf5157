package com.libforge.precompiled.core.manifest;

import java.util.List;

/**
 * Verified release manifest, platforms in manifest order.
 */
public record Manifest(List<PlatformEntry> platforms) {

    public static final String FILE_NAME = "xforge-manifest.json";

    public Manifest {
        platforms = List.copyOf(platforms);
    }
}
