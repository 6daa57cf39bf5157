package com.libforge.precompiled.types;

import java.util.Locale;
import java.util.Optional;

/**
 * How aggressively the resolver falls back to a local build.
 */
public enum ResolveMode {
    AUTO("auto"),
    ALWAYS("always", "download"),
    NEVER("never", "build", "off", "disabled");

    private final String label;
    private final String[] aliases;

    ResolveMode(String label, String... aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a mode name or one of its aliases, ignoring case and surrounding whitespace.
     */
    public static Optional<ResolveMode> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (ResolveMode mode : values()) {
            if (mode.label.equals(value)) {
                return Optional.of(mode);
            }
            for (String alias : mode.aliases) {
                if (alias.equals(value)) {
                    return Optional.of(mode);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
