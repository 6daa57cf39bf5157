package com.libforge.precompiled.formats.api;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DetectionCriteriaTest {

    @Test
    void shouldMatchSuffix() {
        var criteria = new DetectionCriteria(Set.of(".tar.gz", ".tgz"), 200);

        assertThat(criteria.matches("libdemo-linux.tar.gz")).isTrue();
        assertThat(criteria.matches("libdemo-linux.tgz")).isTrue();
    }

    @Test
    void shouldMatchSuffixIgnoringCase() {
        var criteria = new DetectionCriteria(Set.of(".zip"), 200);

        assertThat(criteria.matches("DEMO.ZIP")).isTrue();
    }

    @Test
    void shouldNotMatchOtherSuffixes() {
        var criteria = new DetectionCriteria(Set.of(".tar.gz"), 200);

        assertThat(criteria.matches("demo.tar")).isFalse();
        assertThat(criteria.matches("demo.gz.sig")).isFalse();
        assertThat(criteria.matches(null)).isFalse();
    }

    @Test
    void shouldComputeEntryExtension() {
        assertThat(new ArchiveEntry("pkg/lib/libdemo.so", new byte[0]).extension()).isEqualTo(".so");
        assertThat(new ArchiveEntry("pkg/lib/libdemo.so", new byte[0]).fileName()).isEqualTo("libdemo.so");
        assertThat(new ArchiveEntry("pkg/.hidden", new byte[0]).extension()).isEmpty();
        assertThat(new ArchiveEntry("README", new byte[0]).extension()).isEmpty();
    }
}
