package com.libforge.precompiled.types;

import java.util.Objects;

/**
 * Base type for every failure raised while resolving a precompiled artifact.
 *
 * <p>The message is prefixed with the stage label so operators can tell a broken
 * release from one that simply does not cover the platform.
 */
public class ResolutionException extends RuntimeException {

    private final FailureKind kind;
    private final Stage stage;
    private final String detail;

    public ResolutionException(FailureKind kind, Stage stage, String detail) {
        this(kind, stage, detail, null);
    }

    public ResolutionException(FailureKind kind, Stage stage, String detail, Throwable cause) {
        super("[" + Objects.requireNonNull(stage, "stage").label() + "] " + detail, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.stage = stage;
        this.detail = detail;
    }

    public FailureKind kind() {
        return kind;
    }

    public Stage stage() {
        return stage;
    }

    /**
     * The message without the stage prefix.
     */
    public String detail() {
        return detail;
    }
}
