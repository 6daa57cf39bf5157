package com.libforge.precompiled.core.platform;

import com.libforge.precompiled.core.manifest.Manifest;
import com.libforge.precompiled.core.manifest.PlatformEntry;

/**
 * Picks the platform entry and artifact for a target triple. Entries are scanned in
 * manifest order and the first whose name or triples contain the target wins; the
 * artifact is the entry's first, never the alphabetically first.
 */
public class PlatformMatcher {

    public ArtifactSelection selectArtifact(Manifest manifest, String targetTriple) {
        PlatformEntry platform = manifest.platforms().stream()
                .filter(entry -> entry.supports(targetTriple))
                .findFirst()
                .orElseThrow(() -> new PlatformNotFoundException(targetTriple));

        if (platform.artifacts().isEmpty()) {
            throw new ArtifactNotFoundException(platform.name());
        }
        return new ArtifactSelection(platform, platform.artifacts().get(0));
    }
}
