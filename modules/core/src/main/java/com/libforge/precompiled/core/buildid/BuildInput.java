package com.libforge.precompiled.core.buildid;

import java.util.Objects;

/**
 * One named, ABI-affecting build input. A null value records that the input is
 * absent; absence is hashed, never omitted.
 */
public record BuildInput(String name, String value) {

    public BuildInput {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static BuildInput present(String name, String value) {
        return new BuildInput(name, Objects.requireNonNull(value, "value"));
    }

    public static BuildInput absent(String name) {
        return new BuildInput(name, null);
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * Every input currently affects the ABI.
     */
    public boolean affectsAbi() {
        return true;
    }
}
