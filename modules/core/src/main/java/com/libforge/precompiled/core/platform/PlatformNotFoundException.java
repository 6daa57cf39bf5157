package com.libforge.precompiled.core.platform;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

public class PlatformNotFoundException extends ResolutionException {

    private final String targetTriple;

    public PlatformNotFoundException(String targetTriple) {
        super(FailureKind.PLATFORM_NOT_FOUND, Stage.PLATFORM,
                "no platform match for target \"" + targetTriple + "\" in manifest");
        this.targetTriple = targetTriple;
    }

    public String targetTriple() {
        return targetTriple;
    }
}
