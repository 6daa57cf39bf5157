package com.libforge.precompiled.core.buildid;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

import java.nio.file.Path;

/**
 * A required build input could not be found.
 */
public class BuildInputMissingException extends ResolutionException {

    private final Path path;

    public BuildInputMissingException(String fileName, Path path) {
        super(FailureKind.BUILD_INPUT_MISSING, Stage.BUILD_ID,
                "Missing required file: " + fileName + " (" + path + ")");
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
