package com.libforge.precompiled.core.platform;

/**
 * File extension of the native library produced for a target triple.
 */
public final class LibraryNaming {

    private LibraryNaming() {
    }

    public static String expectedExtension(String targetTriple, LinkMode linkMode) {
        boolean windows = targetTriple.contains("windows");
        if (linkMode == LinkMode.STATIC) {
            return windows && targetTriple.endsWith("msvc") ? ".lib" : ".a";
        }
        if (windows) {
            return ".dll";
        }
        if (targetTriple.contains("apple")) {
            return ".dylib";
        }
        return ".so";
    }
}
