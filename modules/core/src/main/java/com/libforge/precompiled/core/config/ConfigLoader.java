package com.libforge.precompiled.core.config;

import com.libforge.precompiled.core.security.SignatureVerifier;
import com.libforge.precompiled.types.ResolveMode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the {@code precompiled_binaries} section from {@code xforge.yaml}.
 *
 * <p>A missing file or missing section yields {@link Optional#empty()}; that is a
 * routing decision, not an error. Everything else is validated eagerly.
 */
public class ConfigLoader {

    public static final String CONFIG_FILE_NAME = "xforge.yaml";
    static final String SECTION = "precompiled_binaries";

    private static final Set<String> KNOWN_KEYS = Set.of("repository", "public_key", "url_prefix", "mode");

    public Optional<PrecompiledConfig> load(Path projectDir) {
        Path file = projectDir.resolve(CONFIG_FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigInvalidException("Failed to read " + file, e);
        }
        return parse(text);
    }

    public Optional<PrecompiledConfig> parse(String yamlText) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlText);
        } catch (YAMLException e) {
            throw new ConfigInvalidException(CONFIG_FILE_NAME + " is not valid YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            return Optional.empty();
        }
        if (!(root instanceof Map<?, ?> rootMap)) {
            throw new ConfigInvalidException(CONFIG_FILE_NAME + " must be a map");
        }
        Object section = rootMap.get(SECTION);
        if (section == null) {
            return Optional.empty();
        }
        return Optional.of(parseSection(section));
    }

    static PrecompiledConfig parseSection(Object node) {
        if (!(node instanceof Map<?, ?> map)) {
            throw new ConfigInvalidException(SECTION + " must be a map");
        }
        for (Object key : map.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                throw new ConfigInvalidException("Unknown key " + SECTION + "." + key);
            }
        }

        String urlPrefix = optionalString(map, "url_prefix");

        ResolveMode mode = ResolveMode.AUTO;
        Object modeNode = map.get("mode");
        if (modeNode != null) {
            mode = parseMode(modeNode, SECTION + ".mode");
        }

        String rawRepository = requiredString(map, "repository");
        String repository = PrecompiledConfig.normalizeRepository(rawRepository)
                .orElseThrow(() -> new ConfigInvalidException(
                        SECTION + ".repository must be in owner/repo format (or github.com/owner/repo)"));

        String keyHex = requiredString(map, "public_key").trim();
        byte[] publicKey;
        try {
            publicKey = HexFormat.of().parseHex(keyHex);
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException(SECTION + ".public_key must be hex", e);
        }
        if (publicKey.length != PrecompiledConfig.PUBLIC_KEY_LENGTH) {
            throw new ConfigInvalidException("public_key must be 32 bytes, got: " + publicKey.length);
        }
        SignatureVerifier.checkPublicKey(publicKey);

        return new PrecompiledConfig(repository, publicKey, urlPrefix, mode);
    }

    /**
     * Parses a mode value. YAML 1.1 reads a bare {@code off} as boolean false, which
     * is accepted as {@code never}.
     */
    public static ResolveMode parseMode(Object node, String field) {
        if (Boolean.FALSE.equals(node)) {
            return ResolveMode.NEVER;
        }
        if (!(node instanceof String value)) {
            throw new ConfigInvalidException(field + " must be a string");
        }
        return ResolveMode.parse(value).orElseThrow(() -> new ConfigInvalidException(
                field + " must be one of: auto, always, never "
                        + "(aliases: download->always, build|off|disabled->never), got: " + value));
    }

    private static String requiredString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof String s)) {
            throw new ConfigInvalidException(SECTION + "." + key + " must be a string");
        }
        return s;
    }

    private static String optionalString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new ConfigInvalidException(SECTION + "." + key + " must be a string");
        }
        return s;
    }
}
