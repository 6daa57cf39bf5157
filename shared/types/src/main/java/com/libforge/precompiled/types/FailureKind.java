package com.libforge.precompiled.types;

/**
 * Failure taxonomy shared by every resolution stage.
 *
 * <p>{@link #followsPolicy()} tells the fallback policy whether the failure may
 * be turned into a local-build fallback. Kinds that do not follow the policy are
 * fatal regardless of mode.
 */
public enum FailureKind {
    CONFIG_INVALID(false),
    BUILD_INPUT_MISSING(false),
    UNSUPPORTED_ARCHIVE(false),
    MANIFEST_SIGNATURE_INVALID(true),
    ARTIFACT_SIGNATURE_INVALID(true),
    MANIFEST_MALFORMED(true),
    PLATFORM_NOT_FOUND(true),
    ARTIFACT_NOT_FOUND(true),
    LIBRARY_NOT_FOUND_IN_ARCHIVE(true),
    ARCHIVE_CORRUPT(true),
    NOT_FOUND(true),
    NETWORK_ERROR(true),
    IO_ERROR(true),
    TOOLCHAIN_UNAVAILABLE(false);

    private final boolean followsPolicy;

    FailureKind(boolean followsPolicy) {
        this.followsPolicy = followsPolicy;
    }

    public boolean followsPolicy() {
        return followsPolicy;
    }
}
