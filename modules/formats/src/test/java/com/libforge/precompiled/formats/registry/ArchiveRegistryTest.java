package com.libforge.precompiled.formats.registry;

import com.libforge.precompiled.formats.UnsupportedArchiveException;
import com.libforge.precompiled.formats.handlers.TarGzHandlerFactory;
import com.libforge.precompiled.formats.handlers.ZipHandlerFactory;
import com.libforge.precompiled.types.FailureKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ArchiveRegistryTest {

    private final ArchiveRegistry registry = ArchiveRegistry.withDefaults();

    @Test
    void shouldPickFactoryBySuffix() {
        assertThat(registry.findFactory("demo.zip")).get().isInstanceOf(ZipHandlerFactory.class);
        assertThat(registry.findFactory("demo.tar.gz")).get().isInstanceOf(TarGzHandlerFactory.class);
        assertThat(registry.findFactory("demo.tgz")).get().isInstanceOf(TarGzHandlerFactory.class);
    }

    @Test
    void shouldRejectUnknownSuffix() {
        assertThat(registry.findFactory("demo.rar")).isEmpty();

        assertThatThrownBy(() -> registry.handlerFor(Path.of("demo.tar.xz")))
                .isInstanceOf(UnsupportedArchiveException.class)
                .hasMessageContaining("demo.tar.xz")
                .extracting(e -> ((UnsupportedArchiveException) e).kind())
                .isEqualTo(FailureKind.UNSUPPORTED_ARCHIVE);
    }
}
