package com.libforge.precompiled.core.platform;

import com.libforge.precompiled.core.manifest.PlatformEntry;

/**
 * Matched platform and the artifact chosen from it.
 */
public record ArtifactSelection(PlatformEntry platform, String artifactName) {
}
