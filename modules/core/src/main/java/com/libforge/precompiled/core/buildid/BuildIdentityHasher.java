package com.libforge.precompiled.core.buildid;

import com.libforge.precompiled.core.config.ConfigLoader;
import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;
import com.libforge.precompiled.util.BuildId;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Computes the target-independent {@link BuildId} of a crate directory.
 *
 * <p>Identical bytes of the present inputs and an identical absence pattern of the
 * optional ones always give the same id, in every consumer implementation.
 */
public class BuildIdentityHasher {

    public static final String HASH_VERSION = "b1";

    static final String CARGO_TOML = "Cargo.toml";
    static final String CARGO_LOCK = "Cargo.lock";

    static final String INPUT_CARGO_TOML = "cargo.toml";
    static final String INPUT_CARGO_LOCK = "cargo.lock";
    static final String INPUT_TARGET_TRIPLE = "rust.target_triple";
    static final String INPUT_UDL = "uniffi.udl";
    static final String INPUT_CONFIG = "xforge.yaml";

    public BuildId computeBuildId(Path projectDir) {
        return computeBuildId(projectDir, null);
    }

    /**
     * @param interfaceDefinition UniFFI UDL file to hash, or null when the crate has none
     */
    public BuildId computeBuildId(Path projectDir, Path interfaceDefinition) {
        return hash(collectInputs(projectDir, interfaceDefinition));
    }

    public List<BuildInput> collectInputs(Path projectDir, Path interfaceDefinition) {
        Path manifest = projectDir.resolve(CARGO_TOML);
        if (!Files.isRegularFile(manifest)) {
            throw new BuildInputMissingException(CARGO_TOML, manifest);
        }
        Path lockFile = findLockFile(projectDir);

        String udl = null;
        if (interfaceDefinition != null) {
            if (!Files.isRegularFile(interfaceDefinition)) {
                throw new BuildInputMissingException(interfaceDefinition.getFileName().toString(), interfaceDefinition);
            }
            udl = read(interfaceDefinition);
        }

        Path config = projectDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        String configText = Files.isRegularFile(config) ? read(config) : null;

        return List.of(
                BuildInput.present(INPUT_CARGO_TOML, read(manifest)),
                BuildInput.present(INPUT_CARGO_LOCK, read(lockFile)),
                BuildInput.absent(INPUT_TARGET_TRIPLE),
                new BuildInput(INPUT_UDL, udl),
                new BuildInput(INPUT_CONFIG, configText));
    }

    public static BuildId hash(List<BuildInput> inputs) {
        String canonical = CanonicalJson.write(inputs, HASH_VERSION);
        String digest = DigestUtils.sha256Hex(canonical.getBytes(StandardCharsets.UTF_8));
        return new BuildId(HASH_VERSION, digest);
    }

    static String canonicalJson(List<BuildInput> inputs) {
        return CanonicalJson.write(inputs, HASH_VERSION);
    }

    /**
     * Walks from {@code projectDir} up to the filesystem root; workspace crates share
     * the lock file of the workspace root.
     */
    static Path findLockFile(Path projectDir) {
        Path current = projectDir.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(CARGO_LOCK);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            current = current.getParent();
        }
        throw new BuildInputMissingException(CARGO_LOCK, projectDir.resolve(CARGO_LOCK));
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ResolutionException(FailureKind.IO_ERROR, Stage.BUILD_ID, "Failed to read " + file, e);
        }
    }
}
