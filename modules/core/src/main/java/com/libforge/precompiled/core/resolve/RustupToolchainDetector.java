package com.libforge.precompiled.core.resolve;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Looks for a {@code rustup} executable on {@code PATH} and in {@code ~/.cargo/bin}.
 */
public class RustupToolchainDetector implements ToolchainDetector {

    private final Map<String, String> env;
    private final String userHome;
    private final boolean windows;

    public RustupToolchainDetector() {
        this(System.getenv(), System.getProperty("user.home", ""),
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    RustupToolchainDetector(Map<String, String> env, String userHome, boolean windows) {
        this.env = env;
        this.userHome = userHome;
        this.windows = windows;
    }

    @Override
    public boolean isAvailable() {
        String executable = windows ? "rustup.exe" : "rustup";
        return candidateDirs().stream()
                .map(dir -> dir.resolve(executable))
                .anyMatch(Files::isRegularFile);
    }

    List<Path> candidateDirs() {
        List<Path> dirs = new ArrayList<>();
        String path = env.getOrDefault("PATH", "");
        for (String entry : path.split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                dirs.add(Path.of(entry));
            }
        }
        String cargoHome = env.get("CARGO_HOME");
        if (cargoHome != null && !cargoHome.isBlank()) {
            dirs.add(Path.of(cargoHome, "bin"));
        }
        if (!userHome.isBlank()) {
            dirs.add(Path.of(userHome, ".cargo", "bin"));
        }
        return dirs;
    }
}
