package com.libforge.precompiled.core.resolve;

import com.libforge.precompiled.types.ResolutionException;

import java.nio.file.Path;

/**
 * Outcome of one resolution. Never persisted.
 */
public sealed interface Resolution {

    record Downloaded(Path file) implements Resolution {}

    record Fallback(String reason) implements Resolution {}

    record Fatal(ResolutionException error) implements Resolution {}

    static Resolution downloaded(Path file) {
        return new Downloaded(file);
    }

    static Resolution fallback(String reason) {
        return new Fallback(reason);
    }

    static Resolution fatal(ResolutionException error) {
        return new Fatal(error);
    }
}
