package com.libforge.precompiled.core.platform;

import java.util.Locale;

/**
 * Target triple of the running JVM's host.
 */
public final class HostTriple {

    private HostTriple() {
    }

    public static String detect() {
        return fromSystem(System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
    }

    static String fromSystem(String osName, String osArch) {
        String os = osName.toLowerCase(Locale.ROOT);
        String arch = normalizeArch(osArch);
        if (os.startsWith("mac") || os.contains("darwin")) {
            return arch + "-apple-darwin";
        }
        if (os.startsWith("windows")) {
            return arch + "-pc-windows-msvc";
        }
        return arch + "-unknown-linux-gnu";
    }

    static String normalizeArch(String osArch) {
        String arch = osArch.toLowerCase(Locale.ROOT);
        if (arch.equals("aarch64") || arch.equals("arm64")) {
            return "aarch64";
        }
        if (arch.equals("x86") || arch.equals("i386") || arch.equals("i686")) {
            return "i686";
        }
        return "x86_64";
    }
}
