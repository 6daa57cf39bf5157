package com.libforge.precompiled.core.platform;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

public class ArtifactNotFoundException extends ResolutionException {

    public ArtifactNotFoundException(String platformName) {
        super(FailureKind.ARTIFACT_NOT_FOUND, Stage.PLATFORM,
                "manifest platform \"" + platformName + "\" has no artifacts");
    }
}
