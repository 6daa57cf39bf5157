package com.libforge.precompiled.core.manifest;

import java.util.List;
import java.util.Objects;

/**
 * One platform of a release. {@code artifacts} keeps manifest order; the first entry
 * is the one consumers download.
 */
public record PlatformEntry(String name, List<String> triples, List<String> artifacts) {

    public PlatformEntry {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        triples = List.copyOf(triples);
        artifacts = List.copyOf(artifacts);
    }

    public boolean supports(String targetTriple) {
        return name.equals(targetTriple) || triples.contains(targetTriple);
    }
}
