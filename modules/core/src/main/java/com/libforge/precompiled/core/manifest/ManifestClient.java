package com.libforge.precompiled.core.manifest;

import com.libforge.precompiled.core.config.PrecompiledConfig;
import com.libforge.precompiled.core.security.VerifiedFetcher;
import com.libforge.precompiled.core.storage.CacheLayout;
import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.Reporter;
import com.libforge.precompiled.types.Stage;
import com.libforge.precompiled.util.BuildId;

import java.net.URI;
import java.nio.file.Path;

/**
 * Fetches the signed manifest of a build. The JSON is parsed only after its signature
 * verified.
 */
public class ManifestClient {

    private final PrecompiledConfig config;
    private final CacheLayout layout;
    private final VerifiedFetcher fetcher;
    private final ManifestParser parser;
    private final String releaseHost;

    public ManifestClient(PrecompiledConfig config, CacheLayout layout, VerifiedFetcher fetcher,
                          ManifestParser parser, String releaseHost) {
        this.config = config;
        this.layout = layout;
        this.fetcher = fetcher;
        this.parser = parser;
        this.releaseHost = releaseHost;
    }

    public Manifest fetchVerifiedManifest(BuildId buildId, Reporter reporter) {
        URI uri = config.fileUrl(buildId, Manifest.FILE_NAME, releaseHost);
        Path local = layout.manifestFile(buildId, Manifest.FILE_NAME);

        byte[] bytes = fetcher.fetchVerified(local, uri, FailureKind.MANIFEST_SIGNATURE_INVALID,
                Stage.MANIFEST, reporter);
        Manifest manifest = parser.parse(bytes, buildId);
        reporter.debugf("Manifest for %s lists %d platform(s)", buildId, manifest.platforms().size());
        return manifest;
    }
}
