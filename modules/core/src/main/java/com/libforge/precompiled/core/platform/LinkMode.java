package com.libforge.precompiled.core.platform;

import java.util.Locale;
import java.util.Optional;

public enum LinkMode {
    DYNAMIC,
    STATIC;

    public static Optional<LinkMode> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "dynamic", "shared", "cdylib" -> Optional.of(DYNAMIC);
            case "static", "staticlib" -> Optional.of(STATIC);
            default -> Optional.empty();
        };
    }
}
