package com.libforge.precompiled.core.platform;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class LibraryNamingTest {

    @ParameterizedTest
    @CsvSource({
            "x86_64-unknown-linux-gnu, DYNAMIC, .so",
            "aarch64-linux-android, DYNAMIC, .so",
            "aarch64-apple-darwin, DYNAMIC, .dylib",
            "x86_64-pc-windows-msvc, DYNAMIC, .dll",
            "x86_64-pc-windows-gnu, DYNAMIC, .dll",
            "x86_64-pc-windows-msvc, STATIC, .lib",
            "x86_64-pc-windows-gnu, STATIC, .a",
            "aarch64-apple-ios, STATIC, .a",
            "x86_64-unknown-linux-gnu, STATIC, .a"
    })
    void shouldPickExtension(String triple, LinkMode mode, String extension) {
        assertThat(LibraryNaming.expectedExtension(triple, mode)).isEqualTo(extension);
    }
}
