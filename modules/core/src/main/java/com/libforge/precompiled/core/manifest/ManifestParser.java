package com.libforge.precompiled.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libforge.precompiled.util.BuildId;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses manifest JSON into a {@link Manifest}.
 *
 * <p>{@code platforms} may be a list of entries, an object holding a
 * {@code targets} list, or an object keyed by platform; all three normalize to one
 * ordered list. Wrong shapes are errors, never soft defaults.
 */
public class ManifestParser {

    private final ObjectMapper mapper;

    public ManifestParser() {
        this(new ObjectMapper());
    }

    public ManifestParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param expected build id the manifest was fetched for; checked against
     *                 {@code build.id} when the manifest carries one
     */
    public Manifest parse(byte[] json, BuildId expected) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException("manifest is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ManifestFormatException("failed to read manifest JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestFormatException("manifest must be a JSON object");
        }

        checkBuildId(root.get("build"), expected);

        JsonNode platforms = root.get("platforms");
        if (platforms == null || platforms.isNull()) {
            throw new ManifestFormatException("manifest has no platforms");
        }
        return new Manifest(parsePlatforms(platforms));
    }

    private static void checkBuildId(JsonNode build, BuildId expected) {
        if (build == null || build.isNull()) {
            return;
        }
        if (!build.isObject()) {
            throw new ManifestFormatException("manifest build must be an object");
        }
        JsonNode id = build.get("id");
        if (id == null || id.isNull()) {
            return;
        }
        if (!id.isTextual()) {
            throw new ManifestFormatException("manifest build.id must be a string");
        }
        if (expected != null && !expected.toString().equals(id.asText().trim())) {
            throw new ManifestFormatException(
                    "manifest build.id " + id.asText() + " does not match expected " + expected);
        }
    }

    static List<PlatformEntry> parsePlatforms(JsonNode platforms) {
        List<PlatformEntry> entries = new ArrayList<>();
        if (platforms.isArray()) {
            for (JsonNode node : platforms) {
                entries.add(parseEntry(node));
            }
            return entries;
        }
        if (!platforms.isObject()) {
            throw new ManifestFormatException("manifest platforms must be a list or a map");
        }

        JsonNode targets = platforms.get("targets");
        if (targets != null) {
            if (!targets.isArray()) {
                throw new ManifestFormatException("manifest platforms.targets must be a list");
            }
            for (JsonNode node : targets) {
                entries.add(parseEntry(node));
            }
            return entries;
        }

        // Keys only group entries; each entry still names itself.
        for (JsonNode node : platforms) {
            entries.add(parseEntry(node));
        }
        return entries;
    }

    private static PlatformEntry parseEntry(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ManifestFormatException("manifest platform entry must be an object");
        }
        JsonNode nameNode = node.get("name");
        if (nameNode == null || nameNode.isNull()) {
            throw new ManifestFormatException("manifest platform.name is required");
        }
        if (!nameNode.isTextual()) {
            throw new ManifestFormatException("manifest platform.name must be a string");
        }
        String name = nameNode.asText().trim();
        if (name.isEmpty()) {
            throw new ManifestFormatException("manifest platform.name must be non-empty");
        }
        return new PlatformEntry(name,
                stringList(node.get("triples"), name + ".triples"),
                stringList(node.get("artifacts"), name + ".artifacts"));
    }

    private static List<String> stringList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (!node.isArray()) {
            throw new ManifestFormatException("manifest " + field + " must be a list of strings");
        }
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ManifestFormatException("manifest " + field + " must be a list of strings");
            }
            String value = item.asText().trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}
