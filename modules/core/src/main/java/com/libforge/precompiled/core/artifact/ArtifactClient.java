package com.libforge.precompiled.core.artifact;

import com.libforge.precompiled.core.config.PrecompiledConfig;
import com.libforge.precompiled.core.security.VerifiedFetcher;
import com.libforge.precompiled.core.storage.CacheLayout;
import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.Reporter;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;
import com.libforge.precompiled.util.BuildId;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;

/**
 * Fetches a release artifact with the same verify-or-evict discipline as the manifest.
 * The result is opaque archive bytes on disk.
 */
public class ArtifactClient {

    private final PrecompiledConfig config;
    private final CacheLayout layout;
    private final VerifiedFetcher fetcher;
    private final String releaseHost;

    public ArtifactClient(PrecompiledConfig config, CacheLayout layout, VerifiedFetcher fetcher, String releaseHost) {
        this.config = config;
        this.layout = layout;
        this.fetcher = fetcher;
        this.releaseHost = releaseHost;
    }

    public Path fetchVerifiedArtifact(BuildId buildId, String artifactName, Reporter reporter) {
        checkName(artifactName);
        URI uri = config.fileUrl(buildId, artifactName, releaseHost);
        Path local = layout.artifactFile(buildId, artifactName);

        fetcher.fetchVerified(local, uri, FailureKind.ARTIFACT_SIGNATURE_INVALID, Stage.ARTIFACT, reporter);
        reporter.infof("Verified artifact %s", artifactName);
        return local;
    }

    // Artifact names come from the manifest and become both a URL path segment and a cache file name.
    static void checkName(String artifactName) {
        if (artifactName.contains("/") || artifactName.contains("\\")
                || artifactName.equals(".") || artifactName.equals("..")
                || !isPathSegment(artifactName)) {
            throw new ResolutionException(FailureKind.MANIFEST_MALFORMED, Stage.ARTIFACT,
                    "invalid artifact name in manifest: " + artifactName);
        }
    }

    private static boolean isPathSegment(String name) {
        try {
            return name.equals(new URI(name).getRawPath());
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
