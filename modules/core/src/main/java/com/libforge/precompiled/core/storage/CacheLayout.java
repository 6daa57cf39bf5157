package com.libforge.precompiled.core.storage;

import com.libforge.precompiled.util.BuildId;

import java.nio.file.Path;

/**
 * On-disk cache layout. Every path is keyed by build id, so distinct builds never
 * collide:
 * <pre>
 * {root}/manifests/{buildId}/{file}      (+ .sig)
 * {root}/artifacts/{buildId}/{file}      (+ .sig)
 * {root}/extracted/{buildId}/{triple}/
 * </pre>
 */
public record CacheLayout(Path root) {

    public static final String SIGNATURE_SUFFIX = ".sig";

    public Path manifestFile(BuildId buildId, String fileName) {
        return root.resolve("manifests").resolve(buildId.toString()).resolve(fileName);
    }

    public Path artifactFile(BuildId buildId, String fileName) {
        return root.resolve("artifacts").resolve(buildId.toString()).resolve(fileName);
    }

    public Path extractDir(BuildId buildId, String targetTriple) {
        return root.resolve("extracted").resolve(buildId.toString()).resolve(targetTriple);
    }

    public static Path signatureOf(Path payload) {
        return payload.resolveSibling(payload.getFileName() + SIGNATURE_SUFFIX);
    }
}
