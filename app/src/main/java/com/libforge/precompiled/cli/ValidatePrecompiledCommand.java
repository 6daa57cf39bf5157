package com.libforge.precompiled.cli;

import com.libforge.precompiled.core.buildid.BuildIdentityHasher;
import com.libforge.precompiled.core.config.ConfigLoader;
import com.libforge.precompiled.core.config.PrecompiledConfig;
import com.libforge.precompiled.core.config.ResolverSettings;
import com.libforge.precompiled.core.platform.HostTriple;
import com.libforge.precompiled.core.platform.LinkMode;
import com.libforge.precompiled.core.resolve.PrecompiledResolver;
import com.libforge.precompiled.core.resolve.ResolveRequest;
import com.libforge.precompiled.core.resolve.Resolution;
import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.ResolveMode;
import com.libforge.precompiled.util.BuildId;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Runs a full resolution against the published release of a crate: manifest fetch
 * and verification, platform selection, artifact fetch and verification, extraction.
 * Every failure is reported; nothing falls back to a local build.
 *
 * <p>Exit codes: 0 validated, 1 verification or resolution failure, 2 argument or
 * configuration error.
 */
@Command(
        name = "validate-precompiled",
        mixinStandardHelpOptions = true,
        description = "Checks that a signed precompiled library can be resolved for a crate."
)
public class ValidatePrecompiledCommand implements Callable<Integer> {

    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--crate-dir", defaultValue = ".", description = "Crate directory (default: current directory)")
    Path crateDir;

    @Option(names = "--build-id", description = "Build id override instead of hashing the crate")
    String buildId;

    @Option(names = "--target", description = "Target triple (default: host)")
    String target;

    @Option(names = "--link-mode", defaultValue = "DYNAMIC", description = "DYNAMIC or STATIC (default: ${DEFAULT-VALUE})")
    LinkMode linkMode;

    @Option(names = {"--verbose", "-v"}, description = "Print every resolution step")
    boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Path dir = crateDir.toAbsolutePath().normalize();

        Optional<PrecompiledConfig> config;
        try {
            config = new ConfigLoader().load(dir);
        } catch (ResolutionException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_CONFIG;
        }
        if (config.isEmpty()) {
            err.println("xforge.yaml is missing precompiled_binaries config.");
            return EXIT_CONFIG;
        }

        BuildId id;
        try {
            id = buildId != null ? BuildId.parse(buildId) : new BuildIdentityHasher().computeBuildId(dir);
        } catch (IllegalArgumentException e) {
            err.println("Argument error: --build-id " + e.getMessage());
            return EXIT_CONFIG;
        } catch (ResolutionException e) {
            err.println("Build id error: " + e.getMessage());
            return EXIT_CONFIG;
        }
        String triple = target != null ? target : HostTriple.detect();

        ResolverSettings settings;
        try {
            settings = ResolverSettings.load().withModeOverride(ResolveMode.ALWAYS);
        } catch (ResolutionException | IllegalArgumentException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        ResolveRequest request = ResolveRequest.of(dir, triple).withLinkMode(linkMode).withBuildId(id);
        Resolution result = PrecompiledResolver.create(settings)
                .resolve(request, new ConsoleReporter(err, verbose));

        if (result instanceof Resolution.Downloaded downloaded) {
            out.println("Validated precompiled artifact:");
            out.println("  crateDir: " + dir);
            out.println("  buildId: " + id);
            out.println("  target: " + triple);
            out.println("  library: " + downloaded.file());
            out.flush();
            return CommandLine.ExitCode.OK;
        }
        if (result instanceof Resolution.Fatal fatal) {
            err.println("Validation failed: " + fatal.error().getMessage());
            return fatal.error().kind() == FailureKind.CONFIG_INVALID ? EXIT_CONFIG : EXIT_FAILED;
        }
        err.println("Validation failed: " + ((Resolution.Fallback) result).reason());
        return EXIT_FAILED;
    }
}
