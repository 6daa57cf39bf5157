package com.libforge.precompiled.core.config;

import com.libforge.precompiled.types.ResolveMode;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime tunables for the resolver, read through MicroProfile Config so they can be
 * set as system properties, {@code XFORGE_*} environment variables or in
 * {@code META-INF/microprofile-config.properties}.
 *
 * @param cacheRoot    cache directory override; null means {@code <projectDir>/.xforge}
 * @param modeOverride replaces the mode from {@code xforge.yaml}; null keeps it
 */
public record ResolverSettings(
        Duration connectTimeout,
        Duration requestTimeout,
        int maxAttempts,
        Duration initialBackoff,
        double backoffMultiplier,
        String releaseHost,
        Path cacheRoot,
        ResolveMode modeOverride
) {
    static final String CONNECT_TIMEOUT = "xforge.http.connect-timeout-ms";
    static final String REQUEST_TIMEOUT = "xforge.http.request-timeout-ms";
    static final String MAX_ATTEMPTS = "xforge.http.max-attempts";
    static final String INITIAL_BACKOFF = "xforge.http.initial-backoff-ms";
    static final String BACKOFF_MULTIPLIER = "xforge.http.backoff-multiplier";
    static final String RELEASE_HOST = "xforge.release.host";
    static final String CACHE_ROOT = "xforge.cache.root";
    static final String MODE = "xforge.precompiled.mode";

    public static final String DEFAULT_CACHE_DIR = ".xforge";

    public ResolverSettings {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(releaseHost, "releaseHost");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialBackoff.toMillis() < 1) {
            throw new IllegalArgumentException("initialBackoff must be at least 1ms");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
        }
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(
                Duration.ofSeconds(10),
                Duration.ofSeconds(60),
                4,
                Duration.ofMillis(500),
                2.0,
                "github.com",
                null,
                null);
    }

    /**
     * Settings from the global MicroProfile Config.
     */
    public static ResolverSettings load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static ResolverSettings fromConfig(Config config) {
        ResolverSettings d = defaults();
        ResolveMode mode = config.getOptionalValue(MODE, String.class)
                .map(raw -> ConfigLoader.parseMode(raw, MODE))
                .orElse(null);
        return new ResolverSettings(
                config.getOptionalValue(CONNECT_TIMEOUT, Long.class).map(Duration::ofMillis).orElse(d.connectTimeout),
                config.getOptionalValue(REQUEST_TIMEOUT, Long.class).map(Duration::ofMillis).orElse(d.requestTimeout),
                config.getOptionalValue(MAX_ATTEMPTS, Integer.class).orElse(d.maxAttempts),
                config.getOptionalValue(INITIAL_BACKOFF, Long.class).map(Duration::ofMillis).orElse(d.initialBackoff),
                config.getOptionalValue(BACKOFF_MULTIPLIER, Double.class).orElse(d.backoffMultiplier),
                config.getOptionalValue(RELEASE_HOST, String.class).orElse(d.releaseHost),
                config.getOptionalValue(CACHE_ROOT, String.class).map(Path::of).orElse(null),
                mode);
    }

    public Optional<ResolveMode> modeOverrideValue() {
        return Optional.ofNullable(modeOverride);
    }

    /**
     * Cache directory for a project.
     */
    public Path cacheRootFor(Path projectDir) {
        return cacheRoot != null ? cacheRoot : projectDir.resolve(DEFAULT_CACHE_DIR);
    }

    public ResolverSettings withCacheRoot(Path root) {
        return new ResolverSettings(connectTimeout, requestTimeout, maxAttempts, initialBackoff,
                backoffMultiplier, releaseHost, root, modeOverride);
    }

    public ResolverSettings withModeOverride(ResolveMode mode) {
        return new ResolverSettings(connectTimeout, requestTimeout, maxAttempts, initialBackoff,
                backoffMultiplier, releaseHost, cacheRoot, mode);
    }

    public ResolverSettings withRetry(int attempts, Duration backoff) {
        return new ResolverSettings(connectTimeout, requestTimeout, attempts, backoff,
                backoffMultiplier, releaseHost, cacheRoot, modeOverride);
    }
}
