package com.libforge.precompiled.core.manifest;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.util.BuildId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ManifestParserTest {

    private static final BuildId BUILD = BuildId.parse("b1-" + "ab".repeat(32));

    private final ManifestParser parser = new ManifestParser();

    private Manifest parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8), BUILD);
    }

    @Test
    void shouldParseListOfEntries() {
        Manifest manifest = parse("""
                {"platforms": [
                  {"name": "linux-x86_64", "triples": ["x86_64-unknown-linux-gnu"], "artifacts": ["a.tar.gz", "b.zip"]},
                  {"name": "macos-arm64", "triples": ["aarch64-apple-darwin"], "artifacts": ["c.zip"]}
                ]}
                """);

        assertThat(manifest.platforms()).extracting(PlatformEntry::name)
                .containsExactly("linux-x86_64", "macos-arm64");
        assertThat(manifest.platforms().get(0).artifacts()).containsExactly("a.tar.gz", "b.zip");
    }

    @Test
    void shouldParseTargetsList() {
        Manifest manifest = parse("""
                {"platforms": {"targets": [{"name": "x86_64-pc-windows-msvc", "artifacts": ["w.zip"]}]}}
                """);

        assertThat(manifest.platforms()).containsExactly(
                new PlatformEntry("x86_64-pc-windows-msvc", List.of(), List.of("w.zip")));
    }

    @Test
    void shouldParseMapKeepingOrderAndEntryNames() {
        Manifest manifest = parse("""
                {"build": {"id": "%s"},
                 "platforms": {
                   "zz-last-key": {"name": "linux", "triples": ["x86_64-unknown-linux-gnu"], "artifacts": ["l.tgz"]},
                   "aarch64-apple-darwin": {"name": "macos-arm64", "artifacts": ["m.zip"]}
                 }}
                """.formatted(BUILD));

        assertThat(manifest.platforms()).extracting(PlatformEntry::name)
                .containsExactly("linux", "macos-arm64");
    }

    @Test
    void shouldRejectMapEntryWithoutName() {
        assertMalformed("""
                {"platforms": {"aarch64-apple-darwin": {"artifacts": ["m.zip"]}}}
                """, "platform.name is required");
    }

    @Test
    void shouldDefaultMissingListsToEmpty() {
        Manifest manifest = parse("{\"platforms\": [{\"name\": \"p\", \"triples\": null}]}");

        assertThat(manifest.platforms().get(0).triples()).isEmpty();
        assertThat(manifest.platforms().get(0).artifacts()).isEmpty();
    }

    @Test
    void shouldTrimAndDropBlankStrings() {
        Manifest manifest = parse("{\"platforms\": [{\"name\": \" p \", \"triples\": [\" t \", \"  \"], \"artifacts\": [\"\", \"a.zip\"]}]}");

        assertThat(manifest.platforms().get(0))
                .isEqualTo(new PlatformEntry("p", List.of("t"), List.of("a.zip")));
    }

    @Test
    void shouldRejectNonStringListMembers() {
        assertMalformed("{\"platforms\": [{\"name\": \"p\", \"triples\": [1]}]}", "p.triples");
        assertMalformed("{\"platforms\": [{\"name\": \"p\", \"artifacts\": \"a.zip\"}]}", "p.artifacts");
    }

    @Test
    void shouldRejectMissingOrEmptyName() {
        assertMalformed("{\"platforms\": [{\"artifacts\": [\"a.zip\"]}]}", "name");
        assertMalformed("{\"platforms\": [{\"name\": \"\"}]}", "non-empty");
        assertMalformed("{\"platforms\": [{\"name\": 5}]}", "must be a string");
    }

    @Test
    void shouldRejectBadStructure() {
        assertMalformed("[]", "JSON object");
        assertMalformed("{}", "no platforms");
        assertMalformed("{\"platforms\": 3}", "list or a map");
        assertMalformed("{\"platforms\": {\"targets\": {}}}", "targets must be a list");
        assertMalformed("{\"platforms\": [\"linux\"]}", "entry must be an object");
        assertMalformed("{not json", "not valid JSON");
    }

    @Test
    void shouldRejectBuildIdMismatch() {
        assertMalformed("{\"build\": {\"id\": \"b1-" + "cd".repeat(32) + "\"}, \"platforms\": []}",
                "does not match");
    }

    private void assertMalformed(String json, String message) {
        assertThatThrownBy(() -> parse(json))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageStartingWith("[manifest]")
                .hasMessageContaining(message)
                .extracting(e -> ((ResolutionException) e).kind())
                .isEqualTo(FailureKind.MANIFEST_MALFORMED);
    }
}
