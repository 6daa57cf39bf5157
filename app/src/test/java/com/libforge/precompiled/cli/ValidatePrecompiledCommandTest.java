package com.libforge.precompiled.cli;

import com.libforge.precompiled.core.buildid.BuildIdentityHasher;
import com.libforge.precompiled.core.security.Ed25519Keys;
import com.libforge.precompiled.formats.testing.TestArchiveBuilder;
import com.libforge.precompiled.util.BuildId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ValidatePrecompiledCommandTest {

    private static final String TARGET = "x86_64-unknown-linux-gnu";
    private static final String ARTIFACT = "demo-" + TARGET + ".zip";

    @TempDir
    Path dir;

    private ReleaseServer server;
    private Ed25519Keys keys;
    private Path crate;
    private BuildId buildId;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        server = new ReleaseServer();
        keys = Ed25519Keys.generate();
        crate = Files.createDirectories(dir.resolve("crate"));
        Files.writeString(crate.resolve("Cargo.toml"), "[package]\nname = \"demo\"\nversion = \"0.2.0\"\n");
        Files.writeString(crate.resolve("Cargo.lock"), "version = 3\n");
        Files.writeString(crate.resolve("xforge.yaml"), "precompiled_binaries:\n"
                + "  repository: https://github.com/acme/demo\n"
                + "  public_key: " + keys.publicKeyHex() + "\n"
                + "  url_prefix: " + server.baseUrl() + "releases/\n"
                + "  mode: auto\n");
        buildId = new BuildIdentityHasher().computeBuildId(crate);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private void publish() {
        String manifest = "{\"build\":{\"id\":\"" + buildId + "\"},\"platforms\":[{"
                + "\"name\":\"linux-x86_64\",\"triples\":[\"" + TARGET + "\"],"
                + "\"artifacts\":[\"" + ARTIFACT + "\"]}]}";
        publishSigned("xforge-manifest.json", manifest.getBytes(StandardCharsets.UTF_8));
        publishSigned(ARTIFACT, new TestArchiveBuilder()
                .addFile("demo/README.md", "demo")
                .addFile("demo/lib/libdemo.so", "shared-object")
                .buildZip());
    }

    private void publishSigned(String fileName, byte[] payload) {
        server.put("releases/" + buildId + "/" + fileName, payload);
        server.put("releases/" + buildId + "/" + fileName + ".sig", keys.sign(payload));
    }

    private int run(String... args) {
        CommandLine cli = XforgeCli.newCommandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    @Test
    void shouldValidatePublishedRelease() {
        publish();

        int exit = run("validate-precompiled", "--crate-dir", crate.toString(), "--target", TARGET);

        assertThat(exit).as(err.toString()).isZero();
        assertThat(out.toString())
                .contains("Validated precompiled artifact:")
                .contains("buildId: " + buildId)
                .contains("target: " + TARGET)
                .contains("libdemo.so");
        Path library = crate.resolve(".xforge/extracted").resolve(buildId.toString()).resolve(TARGET).resolve("libdemo.so");
        assertThat(library).hasContent("shared-object");
    }

    @Test
    void shouldAcceptBuildIdOverride() throws IOException {
        publish();
        Files.writeString(crate.resolve("Cargo.lock"), "version = 3\n# drifted\n");

        int exit = run("validate-precompiled", "--crate-dir", crate.toString(), "--target", TARGET,
                "--build-id", buildId.toString());

        assertThat(exit).as(err.toString()).isZero();
    }

    @Test
    void shouldFailForMissingRelease() {
        int exit = run("validate-precompiled", "--crate-dir", crate.toString(), "--target", TARGET);

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Validation failed: [manifest] not found");
    }

    @Test
    void shouldFailForUnlistedTarget() {
        publish();

        int exit = run("validate-precompiled", "--crate-dir", crate.toString(), "--target", "aarch64-apple-darwin");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("[platform] no platform match");
    }

    @Test
    void shouldFailAndEvictForTamperedArtifact() {
        publish();
        server.put("releases/" + buildId + "/" + ARTIFACT, "tampered".getBytes(StandardCharsets.UTF_8));

        int exit = run("validate-precompiled", "--crate-dir", crate.toString(), "--target", TARGET);

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("[artifact] signature verification failed for " + ARTIFACT);
        assertThat(crate.resolve(".xforge/artifacts").resolve(buildId.toString()).resolve(ARTIFACT)).doesNotExist();
    }

    @Test
    void shouldExitWithConfigErrorWhenConfigMissing() throws IOException {
        Files.delete(crate.resolve("xforge.yaml"));

        int exit = run("validate-precompiled", "--crate-dir", crate.toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("missing precompiled_binaries");
    }

    @Test
    void shouldExitWithConfigErrorWhenConfigInvalid() throws IOException {
        Files.writeString(crate.resolve("xforge.yaml"), "precompiled_binaries:\n  repository: acme/demo\n  public_key: 00\n");

        int exit = run("validate-precompiled", "--crate-dir", crate.toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("Config error: [config]");
    }

    @Test
    void shouldExitWithConfigErrorForMalformedBuildId() {
        int exit = run("validate-precompiled", "--crate-dir", crate.toString(), "--build-id", "nope");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("--build-id");
    }

    @Test
    void shouldExitWithUsageErrorForUnknownOption() {
        assertThat(run("validate-precompiled", "--bogus")).isEqualTo(2);
    }
}
