package com.libforge.precompiled.core.buildid;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.util.BuildId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class BuildIdentityHasherTest {

    private static final String CARGO_TOML = "[package]\nname = \"demo\"\nversion = \"0.1.0\"\n";
    private static final String CARGO_LOCK = "version = 3\n";

    @TempDir
    Path root;

    private Path crate;
    private final BuildIdentityHasher hasher = new BuildIdentityHasher();

    @BeforeEach
    void setUp() throws IOException {
        crate = Files.createDirectories(root.resolve("crate"));
        Files.writeString(crate.resolve("Cargo.toml"), CARGO_TOML);
        Files.writeString(crate.resolve("Cargo.lock"), CARGO_LOCK);
    }

    @Test
    void shouldMatchKnownVectorWithoutOptionalInputs() {
        BuildId id = hasher.computeBuildId(crate);

        assertThat(id.toString())
                .isEqualTo("b1-aa129e4e4642aa5fd41c255883fa847faaa3869350acbbb1c3018ec2fb38868a");
    }

    @Test
    void shouldMatchKnownVectorWithConfig() throws IOException {
        Files.writeString(crate.resolve("xforge.yaml"), "precompiled_binaries:\n  repository: acme/demo\n");

        assertThat(hasher.computeBuildId(crate).toString())
                .isEqualTo("b1-3f34a2c828c8383ff70a1796b0a2087c4ac252119868fd0d205489f161bc2bc9");
    }

    @Test
    void shouldWriteCanonicalJson() {
        String json = BuildIdentityHasher.canonicalJson(hasher.collectInputs(crate, null));

        assertThat(json).isEqualTo("{\"inputs\":["
                + "{\"affects_abi\":true,\"name\":\"cargo.lock\",\"value\":\"version = 3\\n\"},"
                + "{\"affects_abi\":true,\"name\":\"cargo.toml\",\"value\":\"[package]\\nname = \\\"demo\\\"\\nversion = \\\"0.1.0\\\"\\n\"},"
                + "{\"affects_abi\":true,\"name\":\"rust.target_triple\",\"value\":null},"
                + "{\"affects_abi\":true,\"name\":\"uniffi.udl\",\"value\":null},"
                + "{\"affects_abi\":true,\"name\":\"xforge.yaml\",\"value\":null}"
                + "],\"version\":\"b1\"}");
    }

    @Test
    void shouldEscapeControlCharactersLowercaseAndKeepNonAsciiRaw() {
        List<BuildInput> inputs = List.of(
                BuildInput.present("cargo.toml", "a\u0001b\u00e9\n"),
                BuildInput.present("cargo.lock", CARGO_LOCK),
                BuildInput.absent("rust.target_triple"),
                BuildInput.absent("uniffi.udl"),
                BuildInput.absent("xforge.yaml"));

        assertThat(BuildIdentityHasher.canonicalJson(inputs)).contains("\"a\\u0001b\u00e9\\n\"");
        assertThat(BuildIdentityHasher.hash(inputs).toString())
                .isEqualTo("b1-b27e36e43a096653c7cfeb358812bf30fa79893544cb48326be9e4993c976b15");
    }

    @Test
    void shouldIgnoreInputOrder() {
        List<BuildInput> inputs = hasher.collectInputs(crate, null);
        List<BuildInput> reversed = new ArrayList<>(inputs);
        Collections.reverse(reversed);

        assertThat(BuildIdentityHasher.hash(reversed)).isEqualTo(BuildIdentityHasher.hash(inputs));
    }

    @Test
    void shouldChangeWhenAnyInputChanges() throws IOException {
        BuildId base = hasher.computeBuildId(crate);

        Files.writeString(crate.resolve("Cargo.lock"), CARGO_LOCK + "# changed\n");
        BuildId lockChanged = hasher.computeBuildId(crate);

        Files.writeString(crate.resolve("xforge.yaml"), "");
        BuildId emptyConfig = hasher.computeBuildId(crate);

        assertThat(lockChanged).isNotEqualTo(base);
        assertThat(emptyConfig).isNotEqualTo(lockChanged);
    }

    @Test
    void shouldDistinguishAbsentFromEmptyInterfaceDefinition() throws IOException {
        Path udl = Files.writeString(crate.resolve("demo.udl"), "");

        assertThat(hasher.computeBuildId(crate, udl)).isNotEqualTo(hasher.computeBuildId(crate));
    }

    @Test
    void shouldFindLockFileInAncestor() throws IOException {
        Path member = Files.createDirectories(root.resolve("crate/members/inner"));
        Files.writeString(member.resolve("Cargo.toml"), CARGO_TOML);

        assertThat(BuildIdentityHasher.findLockFile(member)).isEqualTo(crate.resolve("Cargo.lock"));
        assertThat(hasher.computeBuildId(member)).isEqualTo(hasher.computeBuildId(crate));
    }

    @Test
    void shouldFailWithoutCargoToml() throws IOException {
        Files.delete(crate.resolve("Cargo.toml"));

        assertThatThrownBy(() -> hasher.computeBuildId(crate))
                .isInstanceOf(BuildInputMissingException.class)
                .hasMessageContaining("Cargo.toml")
                .extracting(e -> ((BuildInputMissingException) e).kind())
                .isEqualTo(FailureKind.BUILD_INPUT_MISSING);
    }

    @Test
    void shouldFailWithoutLockFileAnywhere() throws IOException {
        Path isolated = Files.createDirectories(root.resolve("isolated"));
        Files.writeString(isolated.resolve("Cargo.toml"), CARGO_TOML);
        assumeNoLockFileAbove(root);

        assertThatThrownBy(() -> hasher.computeBuildId(isolated))
                .isInstanceOf(BuildInputMissingException.class)
                .hasMessageContaining("Cargo.lock");
    }

    @Test
    void shouldFailForMissingInterfaceDefinition() {
        Path udl = crate.resolve("missing.udl");

        assertThatThrownBy(() -> hasher.computeBuildId(crate, udl))
                .isInstanceOf(BuildInputMissingException.class)
                .hasMessageContaining("missing.udl");
    }

    private static void assumeNoLockFileAbove(Path dir) {
        for (Path p = dir.toAbsolutePath(); p != null; p = p.getParent()) {
            assumeFalse(Files.exists(p.resolve("Cargo.lock")),
                    "Cargo.lock found above temp dir");
        }
    }
}
