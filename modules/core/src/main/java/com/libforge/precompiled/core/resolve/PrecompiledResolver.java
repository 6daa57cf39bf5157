package com.libforge.precompiled.core.resolve;

import com.libforge.precompiled.core.artifact.ArtifactClient;
import com.libforge.precompiled.core.buildid.BuildIdentityHasher;
import com.libforge.precompiled.core.config.ConfigLoader;
import com.libforge.precompiled.core.config.PrecompiledConfig;
import com.libforge.precompiled.core.config.ResolverSettings;
import com.libforge.precompiled.core.manifest.Manifest;
import com.libforge.precompiled.core.manifest.ManifestClient;
import com.libforge.precompiled.core.manifest.ManifestParser;
import com.libforge.precompiled.core.platform.ArtifactSelection;
import com.libforge.precompiled.core.platform.LibraryNaming;
import com.libforge.precompiled.core.platform.PlatformMatcher;
import com.libforge.precompiled.core.report.LoggingReporter;
import com.libforge.precompiled.core.security.SignatureVerifier;
import com.libforge.precompiled.core.security.VerifiedFetcher;
import com.libforge.precompiled.core.storage.CacheLayout;
import com.libforge.precompiled.core.storage.CacheStore;
import com.libforge.precompiled.core.storage.HttpTransport;
import com.libforge.precompiled.core.storage.JdkHttpTransport;
import com.libforge.precompiled.formats.extract.LibraryExtractor;
import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.Reporter;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.ResolveMode;
import com.libforge.precompiled.util.BuildId;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Drives a resolution: config, build id, manifest, platform, artifact, extraction,
 * then decides between the downloaded library, a local-build fallback and a fatal
 * error.
 *
 * <p>A missing config and {@code mode=never} fall back before any network access.
 * A stage failure is fatal under {@code mode=always}; otherwise it falls back only
 * when a local toolchain exists to build with.
 */
public class PrecompiledResolver {

    private static final Reporter REPORTER = LoggingReporter.forCategory(PrecompiledResolver.class.getName());

    private final ResolverSettings settings;
    private final HttpTransport transport;
    private final ToolchainDetector toolchain;
    private final ConfigLoader configLoader = new ConfigLoader();
    private final BuildIdentityHasher hasher = new BuildIdentityHasher();
    private final ManifestParser manifestParser = new ManifestParser();
    private final PlatformMatcher matcher = new PlatformMatcher();
    private final LibraryExtractor extractor;

    public PrecompiledResolver(ResolverSettings settings, HttpTransport transport, ToolchainDetector toolchain) {
        this(settings, transport, toolchain, new LibraryExtractor());
    }

    public PrecompiledResolver(ResolverSettings settings, HttpTransport transport, ToolchainDetector toolchain,
                               LibraryExtractor extractor) {
        this.settings = settings;
        this.transport = transport;
        this.toolchain = toolchain;
        this.extractor = extractor;
    }

    /**
     * Resolver on the JDK HTTP client and the rustup toolchain check.
     */
    public static PrecompiledResolver create(ResolverSettings settings) {
        return new PrecompiledResolver(settings, JdkHttpTransport.from(settings), new RustupToolchainDetector());
    }

    /**
     * Resolves with progress logged to this class's JBoss Logging category.
     */
    public Resolution resolve(ResolveRequest request) {
        return resolve(request, REPORTER);
    }

    public Resolution resolve(ResolveRequest request, Reporter reporter) {
        Optional<PrecompiledConfig> loaded;
        try {
            loaded = configLoader.load(request.projectDir());
        } catch (ResolutionException e) {
            return Resolution.fatal(e);
        }
        if (loaded.isEmpty()) {
            reporter.debug("No precompiled_binaries config; using local build");
            return Resolution.fallback("no config");
        }

        ResolveMode mode = settings.modeOverrideValue().orElse(loaded.get().mode());
        if (mode == ResolveMode.NEVER) {
            reporter.debug("Precompiled binaries disabled (mode=never)");
            return Resolution.fallback("mode=never");
        }
        PrecompiledConfig config = loaded.get().withMode(mode);

        BuildId buildId;
        try {
            buildId = request.buildIdOverride()
                    .orElseGet(() -> hasher.computeBuildId(request.projectDir(), request.interfaceDefinition()));
        } catch (ResolutionException e) {
            return Resolution.fatal(e);
        }
        reporter.infof("Resolving precompiled library %s for %s (mode=%s)", buildId, request.targetTriple(), mode);

        try {
            return Resolution.downloaded(fetchAndExtract(config, buildId, request, reporter));
        } catch (ResolutionException e) {
            return applyPolicy(e, mode, reporter);
        }
    }

    private Path fetchAndExtract(PrecompiledConfig config, BuildId buildId, ResolveRequest request,
                                 Reporter reporter) {
        CacheLayout layout = new CacheLayout(settings.cacheRootFor(request.projectDir()));
        VerifiedFetcher fetcher = new VerifiedFetcher(
                new CacheStore(transport, settings), new SignatureVerifier(config.publicKey()));

        Manifest manifest = new ManifestClient(config, layout, fetcher, manifestParser, settings.releaseHost())
                .fetchVerifiedManifest(buildId, reporter);
        ArtifactSelection selection = matcher.selectArtifact(manifest, request.targetTriple());
        reporter.debugf("Matched platform %s, artifact %s", selection.platform().name(), selection.artifactName());

        Path archive = new ArtifactClient(config, layout, fetcher, settings.releaseHost())
                .fetchVerifiedArtifact(buildId, selection.artifactName(), reporter);

        String extension = LibraryNaming.expectedExtension(request.targetTriple(), request.linkMode());
        Path library = extractor.extractLibrary(archive, extension,
                layout.extractDir(buildId, request.targetTriple()), reporter);
        reporter.infof("Using precompiled library %s", library);
        return library;
    }

    Resolution applyPolicy(ResolutionException failure, ResolveMode mode, Reporter reporter) {
        if (!failure.kind().followsPolicy() || mode == ResolveMode.ALWAYS) {
            return Resolution.fatal(failure);
        }
        if (toolchain.isAvailable()) {
            reporter.warn(failure.getMessage() + "; falling back to local build", failure);
            return Resolution.fallback(failure.getMessage());
        }
        return Resolution.fatal(new ResolutionException(FailureKind.TOOLCHAIN_UNAVAILABLE, failure.stage(),
                failure.detail() + " toolchain unavailable", failure));
    }
}
