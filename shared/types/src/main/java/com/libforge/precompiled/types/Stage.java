package com.libforge.precompiled.types;

/**
 * Resolution stages, in the order they run.
 */
public enum Stage {
    CONFIG("config"),
    BUILD_ID("build-id"),
    MANIFEST("manifest"),
    PLATFORM("platform"),
    ARTIFACT("artifact"),
    EXTRACT("extract");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
