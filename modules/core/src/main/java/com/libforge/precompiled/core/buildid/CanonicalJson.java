package com.libforge.precompiled.core.buildid;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.List;

/**
 * Canonical JSON form of the build inputs.
 *
 * <p>Compact output, inputs sorted by name, keys in the fixed order
 * {@code affects_abi, name, value}, then {@code version}. Control characters
 * without a short escape become six-character unicode escapes with lowercase hex and
 * non-ASCII characters are written raw, so every consumer produces the same bytes.
 */
final class CanonicalJson {

    private static final JsonFactory FACTORY = new JsonFactory();

    private CanonicalJson() {
    }

    static String write(List<BuildInput> inputs, String hashVersion) {
        List<BuildInput> sorted = inputs.stream()
                .sorted(Comparator.comparing(BuildInput::name))
                .toList();

        StringWriter out = new StringWriter();
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            gen.setCharacterEscapes(LowercaseEscapes.INSTANCE);
            gen.writeStartObject();
            gen.writeArrayFieldStart("inputs");
            for (BuildInput input : sorted) {
                gen.writeStartObject();
                gen.writeBooleanField("affects_abi", input.affectsAbi());
                gen.writeStringField("name", input.name());
                if (input.isPresent()) {
                    gen.writeStringField("value", input.value());
                } else {
                    gen.writeNullField("value");
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeStringField("version", hashVersion);
            gen.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize build inputs", e);
        }
        return out.toString();
    }

    private static final class LowercaseEscapes extends CharacterEscapes {
        static final LowercaseEscapes INSTANCE = new LowercaseEscapes();

        private final int[] asciiEscapes;

        private LowercaseEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int c = 0; c < 0x20; c++) {
                if (asciiEscapes[c] == CharacterEscapes.ESCAPE_STANDARD) {
                    asciiEscapes[c] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        // Also consulted for every non-ASCII char; null keeps those raw.
        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch >= 0x20) {
                return null;
            }
            return new SerializedString(String.format("\\u%04x", ch));
        }
    }
}
