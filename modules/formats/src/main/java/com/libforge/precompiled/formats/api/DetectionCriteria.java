package com.libforge.precompiled.formats.api;

import java.util.Locale;
import java.util.Set;

/**
 * Criteria for deciding when a handler should be used.
 *
 * @param suffixes  file-name suffixes including the dot (e.g., ".zip", ".tar.gz")
 * @param priority  higher priority wins when several factories match
 */
public record DetectionCriteria(
        Set<String> suffixes,
        int priority
) {
    public DetectionCriteria {
        suffixes = Set.copyOf(suffixes);
    }

    /**
     * Checks whether the file name ends with one of the suffixes, ignoring case.
     */
    public boolean matches(String filename) {
        if (filename == null) {
            return false;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String suffix : suffixes) {
            if (lower.endsWith(suffix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
