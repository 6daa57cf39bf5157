package com.libforge.precompiled.util;

import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic build identity: {@code <hashVersion>-<hex sha-256>}.
 * Doubles as the release tag under which artifacts are published.
 */
public record BuildId(String version, String digest) {
    private static final int DIGEST_HEX_LENGTH = 64; // sha-256
    private static final Pattern VERSION = Pattern.compile("[a-z0-9]+");

    public BuildId {
        Objects.requireNonNull(version, "version cannot be null");
        Objects.requireNonNull(digest, "digest cannot be null");
        if (!VERSION.matcher(version).matches()) {
            throw new IllegalArgumentException("Invalid build id version: " + version);
        }
        if (digest.length() != DIGEST_HEX_LENGTH) {
            throw new IllegalArgumentException(
                "Build id digest must be 64 hex characters, got: " + digest.length()
            );
        }
        try {
            HexFormat.of().parseHex(digest);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex digest: " + digest, e);
        }
        digest = digest.toLowerCase();
    }

    /**
     * Parses {@code b1-<64 hex>}.
     */
    public static BuildId parse(String value) {
        Objects.requireNonNull(value, "build id cannot be null");
        int dash = value.indexOf('-');
        if (dash <= 0) {
            throw new IllegalArgumentException("Build id must be <version>-<digest>: " + value);
        }
        return new BuildId(value.substring(0, dash), value.substring(dash + 1));
    }

    @Override
    public String toString() {
        return version + "-" + digest;
    }
}
