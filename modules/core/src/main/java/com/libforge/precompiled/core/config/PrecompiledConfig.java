package com.libforge.precompiled.core.config;

import com.libforge.precompiled.types.ResolveMode;
import com.libforge.precompiled.util.BuildId;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated {@code precompiled_binaries} section of {@code xforge.yaml}.
 *
 * @param repository {@code owner/repo}, both segments non-empty
 * @param publicKey  raw 32-byte Ed25519 public key
 * @param urlPrefix  download prefix replacing the default release URL, or null
 * @param mode       fallback policy
 */
public record PrecompiledConfig(String repository, byte[] publicKey, String urlPrefix, ResolveMode mode) {
    public static final int PUBLIC_KEY_LENGTH = 32;

    public PrecompiledConfig {
        Objects.requireNonNull(mode, "mode cannot be null");
        if (repository == null || !isOwnerRepo(repository)) {
            throw new ConfigInvalidException(
                "precompiled_binaries.repository must be in owner/repo format, got: " + repository);
        }
        if (publicKey == null || publicKey.length != PUBLIC_KEY_LENGTH) {
            throw new ConfigInvalidException(
                "public_key must be 32 bytes, got: " + (publicKey == null ? 0 : publicKey.length));
        }
        publicKey = Arrays.copyOf(publicKey, publicKey.length);
        if (urlPrefix != null && !urlPrefix.isEmpty() && !isAbsoluteUri(urlPrefix)) {
            throw new ConfigInvalidException("url_prefix must be an absolute URI, got: " + urlPrefix);
        }
    }

    @Override
    public byte[] publicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    public Optional<String> urlPrefixOverride() {
        return urlPrefix == null || urlPrefix.isEmpty() ? Optional.empty() : Optional.of(urlPrefix);
    }

    public PrecompiledConfig withMode(ResolveMode newMode) {
        return new PrecompiledConfig(repository, publicKey, urlPrefix, newMode);
    }

    /**
     * Download URL of a release file: {@code <urlPrefix><buildId>/<fileName>}, where the
     * default prefix is {@code https://<host>/<owner>/<repo>/releases/download/}.
     */
    public URI fileUrl(BuildId buildId, String fileName, String releaseHost) {
        String prefix = urlPrefixOverride()
                .orElseGet(() -> "https://" + releaseHost + "/" + repository + "/releases/download/");
        return URI.create(prefix + buildId + "/" + fileName);
    }

    /**
     * Strips scheme, a leading {@code github.com/} and trailing slashes. Returns empty
     * unless the remainder is exactly two non-empty segments.
     */
    public static Optional<String> normalizeRepository(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String v = raw.trim()
                .replaceFirst("^https?://", "")
                .replaceFirst("^github\\.com/", "")
                .replaceAll("/+$", "");
        return isOwnerRepo(v) ? Optional.of(v) : Optional.empty();
    }

    private static boolean isAbsoluteUri(String value) {
        try {
            return new URI(value).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isOwnerRepo(String value) {
        String[] parts = value.split("/", -1);
        return parts.length == 2 && !parts[0].isEmpty() && !parts[1].isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PrecompiledConfig other)) return false;
        return repository.equals(other.repository)
                && Arrays.equals(publicKey, other.publicKey)
                && Objects.equals(urlPrefix, other.urlPrefix)
                && mode == other.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(repository, Arrays.hashCode(publicKey), urlPrefix, mode);
    }

    @Override
    public String toString() {
        return "PrecompiledConfig[repository=" + repository
                + ", publicKey=" + HexFormat.of().formatHex(publicKey)
                + ", urlPrefix=" + urlPrefix
                + ", mode=" + mode + "]";
    }
}
