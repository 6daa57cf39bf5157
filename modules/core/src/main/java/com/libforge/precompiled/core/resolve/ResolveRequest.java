package com.libforge.precompiled.core.resolve;

import com.libforge.precompiled.core.platform.HostTriple;
import com.libforge.precompiled.core.platform.LinkMode;
import com.libforge.precompiled.util.BuildId;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * @param interfaceDefinition optional UDL file hashed into the build id
 * @param buildId             precomputed build id; null to hash the crate
 */
public record ResolveRequest(
        Path projectDir,
        String targetTriple,
        LinkMode linkMode,
        Path interfaceDefinition,
        BuildId buildId
) {
    public ResolveRequest {
        Objects.requireNonNull(projectDir, "projectDir");
        Objects.requireNonNull(targetTriple, "targetTriple");
        Objects.requireNonNull(linkMode, "linkMode");
    }

    public static ResolveRequest of(Path projectDir, String targetTriple) {
        return new ResolveRequest(projectDir, targetTriple, LinkMode.DYNAMIC, null, null);
    }

    public static ResolveRequest forHost(Path projectDir) {
        return of(projectDir, HostTriple.detect());
    }

    public ResolveRequest withBuildId(BuildId id) {
        return new ResolveRequest(projectDir, targetTriple, linkMode, interfaceDefinition, id);
    }

    public ResolveRequest withLinkMode(LinkMode mode) {
        return new ResolveRequest(projectDir, targetTriple, mode, interfaceDefinition, buildId);
    }

    public ResolveRequest withInterfaceDefinition(Path udl) {
        return new ResolveRequest(projectDir, targetTriple, linkMode, udl, buildId);
    }

    public Optional<BuildId> buildIdOverride() {
        return Optional.ofNullable(buildId);
    }
}
