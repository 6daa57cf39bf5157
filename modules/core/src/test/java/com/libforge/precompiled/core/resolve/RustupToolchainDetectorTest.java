package com.libforge.precompiled.core.resolve;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RustupToolchainDetectorTest {

    @TempDir
    Path dir;

    @Test
    void shouldFindRustupOnPath() throws IOException {
        Path bin = Files.createDirectories(dir.resolve("bin"));
        Files.writeString(bin.resolve("rustup"), "#!/bin/sh\n");

        RustupToolchainDetector detector = new RustupToolchainDetector(
                Map.of("PATH", dir.resolve("empty") + File.pathSeparator + bin), "", false);

        assertThat(detector.isAvailable()).isTrue();
    }

    @Test
    void shouldFindRustupInCargoHome() throws IOException {
        Path bin = Files.createDirectories(dir.resolve("home/.cargo/bin"));
        Files.writeString(bin.resolve("rustup.exe"), "MZ");

        RustupToolchainDetector detector = new RustupToolchainDetector(
                Map.of(), dir.resolve("home").toString(), true);

        assertThat(detector.isAvailable()).isTrue();
    }

    @Test
    void shouldReportMissingToolchain() {
        RustupToolchainDetector detector = new RustupToolchainDetector(
                Map.of("PATH", dir.toString()), dir.toString(), false);

        assertThat(detector.isAvailable()).isFalse();
    }
}
